package com.astro.calpipe.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

public class LightFrame {
    public final Path path;
    public final String binning;
    public final String filter;
    public final LocalDateTime creation;
    public final double exposureTime;
    public final ReductionStatus status;

    public LightFrame(Path path, String binning, String filter, LocalDateTime creation,
                      double exposureTime, ReductionStatus status) {
        this.path = path;
        this.binning = binning;
        this.filter = filter;
        this.creation = creation;
        this.exposureTime = exposureTime;
        this.status = status;
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return fileName() + " (" + binning + ", " + filter + ", " + creation + ")";
    }
}
