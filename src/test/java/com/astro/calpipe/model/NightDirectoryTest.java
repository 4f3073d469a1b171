package com.astro.calpipe.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class NightDirectoryTest {
    private final Path root = Path.of("/data/telescope").toAbsolutePath();

    @Test
    void parsesDateFromName() {
        NightDirectory night = NightDirectory.of(root.resolve("210310"));
        assertEquals(LocalDate.of(2021, 3, 10), night.date());
        assertEquals("210310", night.name());
        assertEquals(root.resolve("210310").resolve("Raw"), night.rawDir());
        assertEquals(root.resolve("210310").resolve("Correction"), night.correctionDir());
    }

    @Test
    void neighborsCrossMonthBoundaries() {
        NightDirectory night = NightDirectory.of(root.resolve("210301"));
        assertEquals("210228", night.neighbor(-1).name());
        assertEquals("210303", night.neighbor(2).name());
        assertEquals(root, night.neighbor(-1).root());
    }

    @Test
    void reducedPathIsStableForARawFrame() {
        NightDirectory night = NightDirectory.of(root.resolve("210310"));
        Path raw = night.rawDir().resolve("M42_0001.fits");
        Path reduced = night.reducedPathFor(raw);
        assertEquals(night.reducedDir().resolve("M42_0001.fits"), reduced);
        assertEquals(raw, night.rawPathFor(reduced));
    }

    @Test
    void rejectsNonDateNames() {
        assertThrows(IllegalArgumentException.class, () -> NightDirectory.of(root.resolve("latest")));
        assertFalse(NightDirectory.isNightName("2103"));
        assertTrue(NightDirectory.isNightName("211231"));
    }
}
