package com.astro.calpipe.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Maximal run of same-key raw frames with no gap above the clustering threshold.
 * Members are ordered by creation time; {@code index} is 1-based in opening order.
 */
public class FrameCluster {
    public final ClusterKey key;
    public final int index;
    public final LocalDateTime representativeTime;
    public final List<RawFrame> members;

    public FrameCluster(ClusterKey key, int index, LocalDateTime representativeTime, List<RawFrame> members) {
        this.key = key;
        this.index = index;
        this.representativeTime = representativeTime;
        this.members = List.copyOf(members);
    }

    public List<Path> memberPaths() {
        return members.stream().map(RawFrame::path).toList();
    }

    public RawFrame last() {
        return members.get(members.size() - 1);
    }

    public double meanExposureTime() {
        return members.stream().mapToDouble(RawFrame::exposureTime).average().orElse(0);
    }

    @Override
    public String toString() {
        return key + " C" + index + " (" + members.size() + " frames @ " + representativeTime + ")";
    }
}
