package com.astro.calpipe.model;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * One observation night on the pipeline side: {@code <root>/<yyMMdd>} with
 * {@code Raw}, {@code Correction} and {@code Reduced} sub directories.
 */
public final class NightDirectory {
    public static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyMMdd");

    public static final String RAW_DIR = "Raw";
    public static final String CORRECTION_DIR = "Correction";
    public static final String REDUCED_DIR = "Reduced";

    private final Path root;
    private final LocalDate date;

    public NightDirectory(Path root, LocalDate date) {
        this.root = root.toAbsolutePath().normalize();
        this.date = date;
    }

    public static NightDirectory of(Path dir) {
        Path abs = dir.toAbsolutePath().normalize();
        String name = abs.getFileName() == null ? "" : abs.getFileName().toString();
        try {
            return new NightDirectory(abs.getParent(), LocalDate.parse(name, NAME_FORMAT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a night directory (expected yyMMdd): " + dir, e);
        }
    }

    public static boolean isNightName(String name) {
        try {
            LocalDate.parse(name, NAME_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    public LocalDate date() { return date; }

    public Path root() { return root; }

    public String name() { return date.format(NAME_FORMAT); }

    public Path path() { return root.resolve(name()); }

    public Path rawDir() { return path().resolve(RAW_DIR); }

    public Path correctionDir() { return path().resolve(CORRECTION_DIR); }

    public Path reducedDir() { return path().resolve(REDUCED_DIR); }

    public NightDirectory neighbor(int dayOffset) {
        return new NightDirectory(root, date.plusDays(dayOffset));
    }

    public boolean exists() {
        return Files.isDirectory(path());
    }

    /** Reduced output location for a raw light frame. Stable across re-reductions. */
    public Path reducedPathFor(Path rawLight) {
        return reducedDir().resolve(rawLight.getFileName().toString());
    }

    public Path rawPathFor(Path reduced) {
        return rawDir().resolve(reduced.getFileName().toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NightDirectory other)) return false;
        return root.equals(other.root) && date.equals(other.date);
    }

    @Override
    public int hashCode() {
        return root.hashCode() * 31 + date.hashCode();
    }

    @Override
    public String toString() {
        return path().toString();
    }
}
