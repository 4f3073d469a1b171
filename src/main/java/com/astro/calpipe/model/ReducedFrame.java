package com.astro.calpipe.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * A light frame after calibration. Holds the source light frame by composition; the output
 * path is derived from the raw path and stays the same when the frame is reduced again.
 */
public class ReducedFrame {
    public final LightFrame light;
    public final Path outputPath;
    public final MatchResult calibration;

    public ReducedFrame(LightFrame light, Path outputPath, MatchResult calibration) {
        this.light = light;
        this.outputPath = outputPath;
        this.calibration = calibration;
    }

    public Path rawPath() {
        return light.path;
    }

    public Map<FrameType, Integer> ages() {
        return calibration.ages();
    }

    /** True when every requested master came from the light frame's own night. */
    public boolean isFinal() {
        return calibration.unresolved().isEmpty()
                && calibration.ages().values().stream().allMatch(a -> a != null && a == 0);
    }
}
