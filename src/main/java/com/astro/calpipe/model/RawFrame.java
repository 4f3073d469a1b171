package com.astro.calpipe.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * One physical calibration exposure as found on disk. Never written by the pipeline.
 *
 * @param filter only meaningful for flats, {@code null} otherwise
 */
public record RawFrame(Path path, FrameType type, String binning, String filter,
                       LocalDateTime creation, double exposureTime) {

    public ClusterKey key() {
        return new ClusterKey(type, binning, type == FrameType.FLAT ? filter : null);
    }
}
