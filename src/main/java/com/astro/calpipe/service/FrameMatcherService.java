package com.astro.calpipe.service;

import com.astro.calpipe.model.CalibrationMatch;
import com.astro.calpipe.model.CalibrationTarget;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.MasterFrame;
import com.astro.calpipe.model.MatchResult;
import com.astro.calpipe.model.NightDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the master of each calibration type closest in time to a frame, starting in its own
 * night and moving outward one day at a time in both directions.
 *
 * <p>At the first day offset that has a compatible master, candidates are ordered by
 * <ol>
 *   <li>smaller absolute time difference to the master's representative time,</li>
 *   <li>the past side before the future side,</li>
 *   <li>lower cluster index.</li>
 * </ol>
 * The age recorded for the choice is that signed day offset.
 *
 * <p>Directory listings are cached per night; call {@link #forget} after writing masters.
 */
public class FrameMatcherService {
    private static final Logger log = LoggerFactory.getLogger(FrameMatcherService.class);

    private final FrameIndexService index;
    private final int maxSearchDays;
    private final Map<NightDirectory, List<MasterFrame>> catalog = new ConcurrentHashMap<>();

    public FrameMatcherService(FrameIndexService index, int maxSearchDays) {
        this.index = index;
        this.maxSearchDays = maxSearchDays;
    }

    public int maxSearchDays() {
        return maxSearchDays;
    }

    public MatchResult match(CalibrationTarget target, Set<FrameType> types) throws IOException {
        return match(target, types, maxSearchDays);
    }

    public MatchResult match(CalibrationTarget target, Set<FrameType> types, int radius) throws IOException {
        Map<FrameType, CalibrationMatch> found = new EnumMap<>(FrameType.class);
        Set<FrameType> unresolved = EnumSet.noneOf(FrameType.class);
        for (FrameType type : types) {
            Optional<CalibrationMatch> m = find(target, type, radius);
            if (m.isPresent()) found.put(type, m.get());
            else unresolved.add(type);
        }
        MatchResult result = new MatchResult(found, unresolved);
        log.debug("Matched {} {} {} at {}: {}", target.night().name(), target.binning(), target.filter(), target.time(), result);
        return result;
    }

    public Optional<CalibrationMatch> find(CalibrationTarget target, FrameType type, int radius) throws IOException {
        int limit = Math.min(radius, maxSearchDays);
        NightDirectory home = target.night();

        List<MasterFrame> local = compatible(home, target, type);
        if (!local.isEmpty()) {
            return Optional.of(new CalibrationMatch(best(local, target, 0), 0));
        }
        for (int k = 1; k <= limit; k++) {
            List<MasterFrame> past = compatible(home.neighbor(-k), target, type);
            List<MasterFrame> future = compatible(home.neighbor(k), target, type);
            if (past.isEmpty() && future.isEmpty()) continue;

            MasterFrame bestPast = past.isEmpty() ? null : best(past, target, -k);
            MasterFrame bestFuture = future.isEmpty() ? null : best(future, target, k);
            if (bestFuture == null) return Optional.of(new CalibrationMatch(bestPast, -k));
            if (bestPast == null) return Optional.of(new CalibrationMatch(bestFuture, k));

            // past wins unless the future master is strictly closer in time
            int cmp = distance(bestFuture, target).compareTo(distance(bestPast, target));
            return cmp < 0
                    ? Optional.of(new CalibrationMatch(bestFuture, k))
                    : Optional.of(new CalibrationMatch(bestPast, -k));
        }
        return Optional.empty();
    }

    public void forget(NightDirectory night) {
        catalog.remove(night);
    }

    private MasterFrame best(List<MasterFrame> candidates, CalibrationTarget target, int offset) {
        return candidates.stream()
                .min(Comparator.<MasterFrame, Duration>comparing(m -> distance(m, target))
                        .thenComparingInt(m -> m.clusterIndex))
                .orElseThrow(() -> new IllegalStateException("No candidate at offset " + offset));
    }

    private static Duration distance(MasterFrame m, CalibrationTarget target) {
        if (m.creationTime == null || target.time() == null) return Duration.ZERO;
        return Duration.between(m.creationTime, target.time()).abs();
    }

    private List<MasterFrame> compatible(NightDirectory night, CalibrationTarget target, FrameType type) throws IOException {
        List<MasterFrame> out = new ArrayList<>();
        for (MasterFrame m : masters(night)) {
            if (m.isCompatible(type, target.binning(), target.filter())) out.add(m);
        }
        return out;
    }

    private List<MasterFrame> masters(NightDirectory night) throws IOException {
        List<MasterFrame> cached = catalog.get(night);
        if (cached != null) return cached;
        List<MasterFrame> listed = night.exists() ? List.copyOf(index.masters(night)) : List.of();
        catalog.put(night, listed);
        return listed;
    }
}
