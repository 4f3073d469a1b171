package com.astro.calpipe.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Per requested type: either a {@link CalibrationMatch} or an unresolved marker. */
public final class MatchResult {
    private final Map<FrameType, CalibrationMatch> matches;
    private final Set<FrameType> unresolved;

    public MatchResult(Map<FrameType, CalibrationMatch> matches, Set<FrameType> unresolved) {
        this.matches = matches.isEmpty() ? new EnumMap<>(FrameType.class) : new EnumMap<>(matches);
        this.unresolved = unresolved.isEmpty() ? EnumSet.noneOf(FrameType.class) : EnumSet.copyOf(unresolved);
    }

    public Optional<CalibrationMatch> get(FrameType type) {
        return Optional.ofNullable(matches.get(type));
    }

    public boolean isResolved(FrameType type) {
        return matches.containsKey(type);
    }

    public Set<FrameType> unresolved() {
        return Collections.unmodifiableSet(unresolved);
    }

    public Set<FrameType> requested() {
        EnumSet<FrameType> all = EnumSet.noneOf(FrameType.class);
        all.addAll(matches.keySet());
        all.addAll(unresolved);
        return all;
    }

    /** Requested types mapped to their age, {@code null} for unresolved ones. */
    public Map<FrameType, Integer> ages() {
        Map<FrameType, Integer> ages = new EnumMap<>(FrameType.class);
        for (FrameType type : requested()) {
            CalibrationMatch m = matches.get(type);
            ages.put(type, m == null ? null : m.ageDays());
        }
        return ages;
    }

    @Override
    public String toString() {
        return "MatchResult" + ages();
    }
}
