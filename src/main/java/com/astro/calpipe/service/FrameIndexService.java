package com.astro.calpipe.service;

import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.LightFrame;
import com.astro.calpipe.model.MasterFrame;
import com.astro.calpipe.model.MasterFrameName;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.NightIndex;
import com.astro.calpipe.model.RawFrame;
import com.astro.calpipe.model.ReductionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only scan of night directories. Missing directories give empty results, never errors.
 */
public class FrameIndexService {
    private static final Logger log = LoggerFactory.getLogger(FrameIndexService.class);

    private final FitsHeaderService headers;

    public FrameIndexService(FitsHeaderService headers) {
        this.headers = headers;
    }

    public static boolean isFitsFile(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts");
    }

    /** FITS files directly inside {@code dir}, sorted by name. Empty when the directory is missing. */
    public static List<Path> listFits(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(FrameIndexService::isFitsFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public NightIndex index(NightDirectory night, int dayOffset) throws IOException {
        return index(night.neighbor(dayOffset));
    }

    public NightIndex index(NightDirectory night) throws IOException {
        if (!Files.isDirectory(night.rawDir())) return NightIndex.empty(night);

        List<RawFrame> calibration = new ArrayList<>();
        List<LightFrame> lights = new ArrayList<>();
        Map<Path, String> unreadable = new LinkedHashMap<>();

        for (Path file : listFits(night.rawDir())) {
            FitsHeaderService.FitsMetadata meta;
            try {
                meta = headers.readHeader(file);
            } catch (IOException e) {
                log.warn("Skipping unreadable frame {}: {}", file, e.getMessage());
                unreadable.put(file, e.getMessage());
                continue;
            }
            if (meta.frameType == null) {
                log.debug("Ignoring {} (IMAGETYP={})", file.getFileName(), meta.imageType);
                continue;
            }
            if (meta.frameType == FrameType.LIGHT) {
                ReductionStatus status = Files.exists(night.reducedPathFor(file))
                        ? ReductionStatus.REDUCED : ReductionStatus.RAW;
                lights.add(new LightFrame(file, meta.binning, meta.filter, meta.dateObs, meta.exposureTime, status));
            } else {
                String filter = meta.frameType == FrameType.FLAT ? meta.filter : null;
                calibration.add(new RawFrame(file, meta.frameType, meta.binning, filter, meta.dateObs, meta.exposureTime));
            }
        }
        log.info("Indexed {}: {} calibration, {} light, {} unreadable",
                night.name(), calibration.size(), lights.size(), unreadable.size());
        return new NightIndex(night, List.copyOf(calibration), List.copyOf(lights), unreadable);
    }

    /** Reads one raw light frame, e.g. for a re-reduction. */
    public LightFrame light(NightDirectory night, Path rawLight) throws IOException {
        FitsHeaderService.FitsMetadata meta = headers.readHeader(rawLight);
        if (meta.frameType != FrameType.LIGHT) {
            throw new IOException(rawLight + " is not a light frame (IMAGETYP=" + meta.imageType + ")");
        }
        ReductionStatus status = Files.exists(night.reducedPathFor(rawLight)) ? ReductionStatus.REDUCED : ReductionStatus.RAW;
        return new LightFrame(rawLight, meta.binning, meta.filter, meta.dateObs, meta.exposureTime, status);
    }

    /** Reads one raw calibration frame, e.g. a master's recorded source. */
    public RawFrame rawFrame(Path file) throws IOException {
        FitsHeaderService.FitsMetadata meta = headers.readHeader(file);
        if (meta.frameType == null || meta.frameType == FrameType.LIGHT) {
            throw new IOException(file + " is not a calibration frame (IMAGETYP=" + meta.imageType + ")");
        }
        String filter = meta.frameType == FrameType.FLAT ? meta.filter : null;
        return new RawFrame(file, meta.frameType, meta.binning, filter, meta.dateObs, meta.exposureTime);
    }

    public boolean isSolved(Path frame) throws IOException {
        return headers.readHeader(frame).header.getBooleanValue(HeaderKeys.ASTROMETRY, false);
    }

    /** Masters present in the night's {@code Correction} directory. */
    public List<MasterFrame> masters(NightDirectory night) throws IOException {
        List<MasterFrame> masters = new ArrayList<>();
        for (Path file : listFits(night.correctionDir())) {
            MasterFrameName name = MasterFrameName.parse(file.getFileName().toString());
            if (name == null) continue;
            try {
                masters.add(master(night, file, name));
            } catch (IOException e) {
                log.warn("Ignoring unreadable master {}: {}", file, e.getMessage());
            }
        }
        return masters;
    }

    public MasterFrame master(NightDirectory night, Path file) throws IOException {
        MasterFrameName name = MasterFrameName.parse(file.getFileName().toString());
        if (name == null) throw new IOException("Not a master frame name: " + file.getFileName());
        return master(night, file, name);
    }

    private MasterFrame master(NightDirectory night, Path file, MasterFrameName name) throws IOException {
        FitsHeaderService.FitsMetadata meta = headers.readHeader(file);
        LocalDateTime created = meta.dateObs;
        String filter = name.filter();
        if (name.type() == FrameType.FLAT && meta.filter != null) filter = meta.filter;
        List<Path> sources = HeaderKeys.readSources(meta.header);
        int count = meta.header.getIntValue(HeaderKeys.SOURCE_COUNT, sources.size());
        return new MasterFrame(file, night, name.type(), name.binning(), filter, name.clusterIndex(),
                created, count, sources);
    }
}
