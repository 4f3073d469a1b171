package com.astro.calpipe.pending;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astro.calpipe.error.LedgerLockException;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.PendingKind;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PendingLedgerTest {

    @TempDir
    Path root;

    private NightDirectory night;
    private PendingLedger ledger;

    @BeforeEach
    void setUp() {
        night = new NightDirectory(root, LocalDate.of(2021, 3, 10));
        ledger = new PendingLedger(root.resolve("pending.csv"), 2, Duration.ofMillis(10));
    }

    private PendingEntry light(String name, Integer bias, Integer dark, Integer flat) {
        Map<FrameType, Integer> ages = new EnumMap<>(FrameType.class);
        ages.put(FrameType.BIAS, bias);
        ages.put(FrameType.DARK, dark);
        ages.put(FrameType.FLAT, flat);
        return PendingEntry.forProduct(PendingKind.LIGHT, night.reducedDir().resolve(name), night, "1x1", "R",
                LocalDateTime.of(2021, 3, 10, 23, 0), ages, 5);
    }

    @Test
    void missingLedgerReadsAsEmpty() throws Exception {
        PendingLedger.Snapshot snapshot = ledger.read();
        assertTrue(snapshot.entries().isEmpty());
        assertTrue(snapshot.corrupt().isEmpty());
    }

    @Test
    void writesHeaderRow() throws Exception {
        ledger.upsert(light("m42_001.fits", 0, 0, 2));

        List<String> lines = Files.readAllLines(ledger.file(), StandardCharsets.UTF_8);
        assertEquals(String.join(",", PendingLedger.HEADER), lines.get(0));
        assertEquals(2, lines.size());
    }

    @Test
    void upsertReplacesRowWithSamePath() throws Exception {
        ledger.upsert(light("m42_001.fits", 0, 0, 2));
        ledger.upsert(light("m42_002.fits", 0, 0, null));
        ledger.upsert(light("m42_001.fits", 0, 0, 1));

        List<PendingEntry> entries = ledger.read().entries();
        assertEquals(2, entries.size());
        assertEquals(Integer.valueOf(1), entries.get(0).age(FrameType.FLAT));
        assertEquals(night.reducedDir().resolve("m42_001.fits"), entries.get(0).path);
    }

    @Test
    void unresolvedAndNotApplicableAgesSurviveTheFile() throws Exception {
        PendingEntry lightEntry = light("m42_001.fits", 0, null, -3);
        Map<FrameType, Integer> biasOnly = new EnumMap<>(FrameType.class);
        biasOnly.put(FrameType.BIAS, null);
        PendingEntry darkEntry = PendingEntry.forProduct(PendingKind.MASTER_DARK,
                night.correctionDir().resolve("master_dark1x1C1.fits"), night, "1x1", null,
                LocalDateTime.of(2021, 3, 10, 18, 0), biasOnly, 5);
        ledger.upsert(List.of(lightEntry, darkEntry));

        List<PendingEntry> entries = ledger.read().entries();
        assertEquals(List.of(lightEntry, darkEntry), entries);
        assertTrue(entries.get(1).isApplicable(FrameType.BIAS));
        assertNull(entries.get(1).age(FrameType.BIAS));
        assertFalse(entries.get(1).isApplicable(FrameType.FLAT));

        String darkRow = Files.readAllLines(ledger.file()).get(2);
        assertTrue(darkRow.startsWith("MASTER_DARK,1x1,,2021-03-10T18:00,?,-,-,2021-03-15,"), darkRow);
    }

    @Test
    void corruptRowsAreReportedAndKeptOnUpsert() throws Exception {
        String garbage = "LIGHT,1x1,R,2021-03-10T23:00,zero,0,0,2021-03-10,/nights/210310,/nights/210310/Reduced/x.fits";
        Files.write(ledger.file(), List.of(String.join(",", PendingLedger.HEADER), garbage, "half,a,row"));

        PendingLedger.Snapshot snapshot = ledger.read();
        assertTrue(snapshot.entries().isEmpty());
        assertEquals(2, snapshot.corrupt().size());
        assertEquals("/nights/210310/Reduced/x.fits", snapshot.corrupt().get(0).path());
        assertEquals(2, snapshot.corrupt().get(0).error().line());

        ledger.upsert(light("m42_001.fits", 0, 0, 2));
        List<String> lines = Files.readAllLines(ledger.file());
        assertEquals(4, lines.size());
        assertEquals(garbage, lines.get(1));
        assertEquals("half,a,row", lines.get(2));
    }

    @Test
    void failsWhenAnotherHolderKeepsTheLock() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try {
                ledger.transaction(session -> {
                    holding.countDown();
                    try {
                        return release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                });
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        holder.start();
        try {
            assertTrue(holding.await(5, TimeUnit.SECONDS));
            PendingLedger contender = new PendingLedger(ledger.file(), 1, Duration.ofMillis(10));
            assertThrows(LedgerLockException.class, () -> contender.upsert(light("m42_001.fits", 0, 0, 2)));
        } finally {
            release.countDown();
            holder.join();
        }
        assertFalse(Files.exists(ledger.file()));

        ledger.upsert(light("m42_001.fits", 0, 0, 2));
        assertEquals(1, ledger.read().entries().size());
    }

    @Test
    void leavesNoTempFilesBehind() throws Exception {
        ledger.upsert(light("m42_001.fits", 0, 0, 2));
        ledger.transaction(session -> {
            session.rewrite(session.read().entries());
            return null;
        });

        try (Stream<Path> files = Files.list(root)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }
}
