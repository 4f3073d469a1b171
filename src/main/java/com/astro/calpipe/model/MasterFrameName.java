package com.astro.calpipe.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name of a master frame: {@code master_{type}{binning}{filter-if-flat}C{index}.fits},
 * e.g. {@code master_bias3x3C2.fits} or {@code master_flat1x1H-alphaC1.fits}.
 */
public record MasterFrameName(FrameType type, String binning, String filter, int clusterIndex) {

    private static final Pattern NAME = Pattern.compile(
            "master_(bias|dark|flat)(\\d+x\\d+)(.*)C(\\d+)\\.fits");

    public MasterFrameName {
        if (!type.isCalibration()) throw new IllegalArgumentException("No master for " + type);
        if (clusterIndex < 1) throw new IllegalArgumentException("Cluster index starts at 1: " + clusterIndex);
        filter = type == FrameType.FLAT ? safeFilter(filter) : null;
    }

    public static MasterFrameName of(FrameCluster cluster) {
        return new MasterFrameName(cluster.key.type(), cluster.key.binning(), cluster.key.filter(), cluster.index);
    }

    public String fileName() {
        return "master_" + type.label() + binning + (filter != null ? filter : "") + "C" + clusterIndex + ".fits";
    }

    /** Returns {@code null} when the name is not a master frame name. */
    public static MasterFrameName parse(String fileName) {
        Matcher m = NAME.matcher(fileName);
        if (!m.matches()) return null;
        FrameType type = FrameType.fromLabel(m.group(1));
        String filter = m.group(3);
        if (type != FrameType.FLAT && !filter.isEmpty()) return null;
        if (type == FrameType.FLAT && filter.isEmpty()) return null;
        int clusterIndex;
        try {
            clusterIndex = Integer.parseInt(m.group(4));
        } catch (NumberFormatException e) {
            return null;
        }
        if (clusterIndex < 1) return null;
        return new MasterFrameName(type, m.group(2), filter, clusterIndex);
    }

    // Filters like "H alpha" or "OIII/5nm" must not break the path.
    static String safeFilter(String filter) {
        if (filter == null || filter.isBlank()) return "none";
        return filter.trim().replaceAll("[\\s/\\\\]+", "_");
    }

    @Override
    public String toString() {
        return fileName();
    }
}
