package com.astro.calpipe.service;

import com.astro.calpipe.error.MissingMandatoryCalibrationException;
import com.astro.calpipe.model.CalibrationMatch;
import com.astro.calpipe.model.CalibrationTarget;
import com.astro.calpipe.model.FrameType;
import com.astro.calpipe.model.LightFrame;
import com.astro.calpipe.model.MatchResult;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.PendingKind;
import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.model.ReducedFrame;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * Calibrates light frames: {@code (light - bias - dark * EXPTIME) / flat}, with the masters
 * the matcher picks. The output always lands at the same {@code Reduced/} path, so a later
 * re-reduction replaces it.
 */
public class ReductionService {
    private static final Logger log = LoggerFactory.getLogger(ReductionService.class);

    private final PipelineConfig config;
    private final FitsImageService images;
    private final FrameMatcherService matcher;

    public ReductionService(PipelineConfig config, FitsImageService images, FrameMatcherService matcher) {
        this.config = config;
        this.images = images;
        this.matcher = matcher;
    }

    public ReducedFrame reduce(NightDirectory night, LightFrame light) throws MissingMandatoryCalibrationException, IOException {
        return reduce(night, light, config.getMaxSearchDays());
    }

    /**
     * @param radius how many days away the matcher may look
     * @throws MissingMandatoryCalibrationException when the bias (or, without partial reduction,
     *         any requested type) is unresolved; carries the ledger row for the frame
     */
    public ReducedFrame reduce(NightDirectory night, LightFrame light, int radius)
            throws MissingMandatoryCalibrationException, IOException {
        Path output = night.reducedPathFor(light.path);
        MatchResult match = matcher.match(CalibrationTarget.of(night, light), config.calibrationTypes(), radius);

        Set<FrameType> missing = EnumSet.noneOf(FrameType.class);
        for (FrameType t : match.unresolved()) {
            if (t == FrameType.BIAS || !config.isAllowPartial()) missing.add(t);
        }
        if (!missing.isEmpty()) {
            throw new MissingMandatoryCalibrationException(light.fileName(), missing, pendingEntry(night, light, match));
        }

        FitsImage raw = images.read(light.path);
        float[][] data = new float[raw.height()][];
        for (int y = 0; y < raw.height(); y++) data[y] = raw.data[y].clone();

        FitsImage bias = master(match, FrameType.BIAS, raw, light);
        subtract(data, bias.data, 1.0);

        FitsImage dark = master(match, FrameType.DARK, raw, light);
        if (dark != null) subtract(data, dark.data, light.exposureTime);

        FitsImage flat = master(match, FrameType.FLAT, raw, light);
        if (flat != null) divide(data, flat.data);

        Header header = images.copyHeader(raw.header);
        HeaderKeys.put(header, HeaderKeys.PRAW, light.path.toString(), "Raw file, pipeline side");
        HeaderKeys.put(header, HeaderKeys.PRED, output.toString(), "Reduced file");
        for (FrameType type : FrameType.values()) {
            if (!type.isCalibration()) continue;
            CalibrationMatch m = match.get(type).orElse(null);
            if (m == null) {
                header.deleteKey(type.masterKey());
                header.deleteKey(type.ageKey());
                continue;
            }
            HeaderKeys.put(header, type.masterKey(), m.master().path.toString(), "Master " + type.label() + " used");
            HeaderKeys.put(header, type.ageKey(), m.ageDays(), "Relative age of master " + type.label() + " (days)");
        }

        images.write(output, data, header);
        ReducedFrame reduced = new ReducedFrame(light, output, match);
        if (reduced.isFinal()) {
            log.info("Reduced {}", light.fileName());
        } else {
            log.warn("Reduced {} with non-zero or missing ages {}", light.fileName(), match.ages());
        }
        return reduced;
    }

    /** Ledger row for a reduced frame, or {@code null} when every master came from its own night. */
    public PendingEntry followUp(NightDirectory night, ReducedFrame frame) {
        if (!PendingEntry.needsFollowUp(frame.ages())) return null;
        return pendingEntry(night, frame.light, frame.calibration);
    }

    private PendingEntry pendingEntry(NightDirectory night, LightFrame light, MatchResult match) {
        return PendingEntry.forProduct(PendingKind.LIGHT, night.reducedPathFor(light.path), night, light.binning,
                light.filter, light.creation, match.ages(), config.getMaxSearchDays());
    }

    private FitsImage master(MatchResult match, FrameType type, FitsImage raw, LightFrame light) throws IOException {
        CalibrationMatch m = match.get(type).orElse(null);
        if (m == null) return null;
        FitsImage img = images.read(m.master().path);
        if (!img.sameShape(raw)) {
            throw new IOException("Master " + m.master() + " is " + img.width() + "x" + img.height()
                    + ", light " + light.fileName() + " is " + raw.width() + "x" + raw.height());
        }
        return img;
    }

    private static void subtract(float[][] data, float[][] other, double factor) {
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) data[y][x] = (float) (data[y][x] - other[y][x] * factor);
        }
    }

    private static void divide(float[][] data, float[][] flat) {
        for (int y = 0; y < data.length; y++) {
            for (int x = 0; x < data[y].length; x++) data[y][x] = data[y][x] / flat[y][x];
        }
    }
}
