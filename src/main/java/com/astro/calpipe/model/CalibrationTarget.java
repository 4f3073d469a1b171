package com.astro.calpipe.model;

import java.time.LocalDateTime;

/** What the matcher needs to know about the frame being calibrated. */
public record CalibrationTarget(NightDirectory night, LocalDateTime time, String binning, String filter) {

    public static CalibrationTarget of(NightDirectory night, LightFrame light) {
        return new CalibrationTarget(night, light.creation, light.binning, light.filter);
    }

    public static CalibrationTarget of(NightDirectory night, FrameCluster cluster) {
        return new CalibrationTarget(night, cluster.representativeTime, cluster.key.binning(), cluster.key.filter());
    }
}
