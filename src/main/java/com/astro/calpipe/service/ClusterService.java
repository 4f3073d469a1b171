package com.astro.calpipe.service;

import com.astro.calpipe.model.ClusterKey;
import com.astro.calpipe.model.FrameCluster;
import com.astro.calpipe.model.RawFrame;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits raw calibration frames into time-coherent clusters: a new cluster opens whenever
 * the gap to the previous frame is strictly larger than the configured threshold.
 */
public class ClusterService {

    private static final Comparator<RawFrame> CHRONOLOGICAL = Comparator
            .comparing(RawFrame::creation)
            .thenComparing(f -> f.path().getFileName().toString());

    private final Duration gap;
    private final int minFrames;

    public ClusterService(Duration gap, int minFrames) {
        if (gap.isNegative() || gap.isZero()) throw new IllegalArgumentException("gap must be positive");
        this.gap = gap;
        this.minFrames = Math.max(1, minFrames);
    }

    /** Clusters per key, keys in {@link ClusterKey#ORDER}. */
    public Map<ClusterKey, List<FrameCluster>> clusterAll(List<RawFrame> frames) {
        Map<ClusterKey, List<RawFrame>> byKey = new TreeMap<>(ClusterKey.ORDER);
        for (RawFrame f : frames) {
            byKey.computeIfAbsent(f.key(), k -> new ArrayList<>()).add(f);
        }
        Map<ClusterKey, List<FrameCluster>> out = new TreeMap<>(ClusterKey.ORDER);
        byKey.forEach((key, list) -> {
            List<FrameCluster> clusters = cluster(list);
            if (!clusters.isEmpty()) out.put(key, clusters);
        });
        return out;
    }

    /**
     * Clusters frames sharing one key. Input order does not matter; indices are 1-based in
     * chronological order and are assigned before small clusters are dropped.
     */
    public List<FrameCluster> cluster(List<RawFrame> frames) {
        if (frames.isEmpty()) return List.of();
        ClusterKey key = frames.get(0).key();
        for (RawFrame f : frames) {
            if (!f.key().equals(key)) throw new IllegalArgumentException("Mixed keys: " + key + " and " + f.key());
        }

        List<RawFrame> sorted = new ArrayList<>(frames);
        sorted.sort(CHRONOLOGICAL);

        List<FrameCluster> clusters = new ArrayList<>();
        List<RawFrame> current = new ArrayList<>();
        RawFrame previous = null;
        for (RawFrame f : sorted) {
            if (previous != null && Duration.between(previous.creation(), f.creation()).compareTo(gap) > 0) {
                clusters.add(close(key, clusters.size() + 1, current));
                current = new ArrayList<>();
            }
            current.add(f);
            previous = f;
        }
        clusters.add(close(key, clusters.size() + 1, current));

        clusters.removeIf(c -> c.members.size() < minFrames);
        return List.copyOf(clusters);
    }

    private FrameCluster close(ClusterKey key, int index, List<RawFrame> members) {
        // lower median
        RawFrame representative = members.get((members.size() - 1) / 2);
        return new FrameCluster(key, index, representative.creation(), members);
    }
}
