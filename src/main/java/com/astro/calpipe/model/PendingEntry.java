package com.astro.calpipe.model;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One ledger row: a product whose calibration used masters from other nights (or none at all)
 * and may still improve before {@link #expires}.
 */
public final class PendingEntry {
    public final PendingKind kind;
    public final Path path;
    public final Path nightDir;
    public final String binning;
    public final String filter;
    public final LocalDateTime created;
    public final LocalDate expires;
    private final Map<FrameType, Integer> ages;

    /**
     * @param ages one entry per applicable calibration type; a {@code null} value marks it unresolved
     */
    public PendingEntry(PendingKind kind, Path path, Path nightDir, String binning, String filter,
                        LocalDateTime created, LocalDate expires, Map<FrameType, Integer> ages) {
        this.kind = Objects.requireNonNull(kind);
        this.path = Objects.requireNonNull(path);
        this.nightDir = Objects.requireNonNull(nightDir);
        this.binning = binning;
        this.filter = filter;
        this.created = created;
        this.expires = expires;
        this.ages = new EnumMap<>(FrameType.class);
        for (FrameType type : kind.calibrationTypes()) {
            if (ages.containsKey(type)) this.ages.put(type, ages.get(type));
        }
    }

    public static PendingEntry forProduct(PendingKind kind, Path path, NightDirectory night, String binning,
                                          String filter, LocalDateTime created, Map<FrameType, Integer> ages,
                                          int searchRadiusDays) {
        Map<FrameType, Integer> own = new EnumMap<>(FrameType.class);
        for (FrameType type : kind.calibrationTypes()) {
            if (ages.containsKey(type)) own.put(type, ages.get(type));
        }
        return new PendingEntry(kind, path, night.path(), binning, filter, created,
                expiration(night.date(), own, searchRadiusDays), own);
    }

    /**
     * Latest date at which a closer master can still show up: the night plus the largest offset
     * in use, or plus the whole search radius while any type is unresolved.
     */
    public static LocalDate expiration(LocalDate night, Map<FrameType, Integer> ages, int searchRadiusDays) {
        int span = 0;
        for (Integer age : ages.values()) {
            if (age == null) return night.plusDays(searchRadiusDays);
            span = Math.max(span, Math.abs(age));
        }
        return night.plusDays(span);
    }

    /** Returns {@code true} when a product with these ages needs a ledger row. */
    public static boolean needsFollowUp(Map<FrameType, Integer> ages) {
        return ages.values().stream().anyMatch(a -> a == null || a != 0);
    }

    public Map<FrameType, Integer> ages() {
        return Collections.unmodifiableMap(ages);
    }

    /** Age for a type; {@code null} when unresolved or not applicable. */
    public Integer age(FrameType type) {
        return ages.get(type);
    }

    public boolean isApplicable(FrameType type) {
        return ages.containsKey(type);
    }

    public boolean isResolved() {
        return !needsFollowUp(ages);
    }

    /** Largest known offset, or {@code null} while some type is still unresolved. */
    public Integer maxKnownOffset() {
        int max = 0;
        for (Integer age : ages.values()) {
            if (age == null) return null;
            max = Math.max(max, Math.abs(age));
        }
        return max;
    }

    public PendingState classify(LocalDate today) {
        if (isResolved()) return PendingState.RESOLVED;
        if (today.isAfter(expires)) return PendingState.EXPIRED;
        return PendingState.LOGGED;
    }

    public NightDirectory night() {
        return NightDirectory.of(nightDir);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PendingEntry other)) return false;
        return kind == other.kind && path.equals(other.path) && nightDir.equals(other.nightDir)
                && Objects.equals(binning, other.binning) && Objects.equals(filter, other.filter)
                && Objects.equals(created, other.created) && Objects.equals(expires, other.expires)
                && ages.equals(other.ages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, path, nightDir, binning, filter, created, expires, ages);
    }

    @Override
    public String toString() {
        return kind + " " + path.getFileName() + " ages=" + ages + " expires=" + expires;
    }
}
