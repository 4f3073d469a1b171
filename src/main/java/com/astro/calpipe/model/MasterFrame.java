package com.astro.calpipe.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A combined calibration product, owned by the {@code Correction} directory of the night
 * it was built in. Read-only once written.
 */
public class MasterFrame {
    public final Path path;
    public final NightDirectory night;
    public final FrameType type;
    public final String binning;
    public final String filter;
    public final int clusterIndex;
    public final LocalDateTime creationTime;
    public final int sourceCount;
    public final List<Path> sourcePaths;

    public MasterFrame(Path path, NightDirectory night, FrameType type, String binning, String filter,
                       int clusterIndex, LocalDateTime creationTime, List<Path> sourcePaths) {
        this(path, night, type, binning, filter, clusterIndex, creationTime, sourcePaths.size(), sourcePaths);
    }

    public MasterFrame(Path path, NightDirectory night, FrameType type, String binning, String filter,
                       int clusterIndex, LocalDateTime creationTime, int sourceCount, List<Path> sourcePaths) {
        this.path = path;
        this.night = night;
        this.type = type;
        this.binning = binning;
        this.filter = filter;
        this.clusterIndex = clusterIndex;
        this.creationTime = creationTime;
        this.sourceCount = sourceCount;
        this.sourcePaths = List.copyOf(sourcePaths);
    }

    public ClusterKey key() {
        return new ClusterKey(type, binning, type == FrameType.FLAT ? filter : null);
    }

    /** Whether this master can calibrate a frame of the given binning (and filter, for flats). */
    public boolean isCompatible(FrameType wanted, String wantedBinning, String wantedFilter) {
        if (type != wanted || !binning.equals(wantedBinning)) return false;
        if (type != FrameType.FLAT) return true;
        // master file names only carry the file-name safe filter
        return MasterFrameName.safeFilter(filter).equals(MasterFrameName.safeFilter(wantedFilter));
    }

    @Override
    public String toString() {
        return night.name() + "/" + path.getFileName();
    }
}
