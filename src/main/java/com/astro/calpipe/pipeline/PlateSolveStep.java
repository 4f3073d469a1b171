package com.astro.calpipe.pipeline;

import com.astro.calpipe.model.CelestialPoint;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.service.FrameIndexService;
import com.astro.calpipe.service.HeaderKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Plate solves the night's reduced frames with ASTAP and stamps the solution into their headers.
 * Frames that are already solved are skipped.
 */
public class PlateSolveStep implements PipelineStep {
    private static final Logger log = LoggerFactory.getLogger(PlateSolveStep.class);

    @Override
    public String name() {
        return "astrometry";
    }

    @Override
    public Set<Product> requires() {
        return EnumSet.of(Product.REDUCED_FRAMES);
    }

    @Override
    public Set<Product> provides() {
        return EnumSet.of(Product.ASTROMETRY);
    }

    @Override
    public void run(NightContext ctx) throws IOException {
        PipelineServices s = ctx.services;
        if (!s.plateSolver.isConfigured()) {
            log.warn("Astrometry skipped for {}: astrometry.astap_path/astap_db not set", ctx.night.name());
            ctx.summary.fail(RunSummary.ErrorKind.PLATE_SOLVE, ctx.night.name(), "ASTAP not configured");
            return;
        }
        for (Path reduced : FrameIndexService.listFits(ctx.night.reducedDir())) {
            try {
                if (s.index.isSolved(reduced)) continue;
                Optional<CelestialPoint> solution = s.plateSolver.solve(reduced);
                if (solution.isEmpty()) {
                    ctx.summary.fail(RunSummary.ErrorKind.PLATE_SOLVE, reduced, "no solution");
                    continue;
                }
                CelestialPoint p = solution.get();
                s.images.rewriteHeader(reduced, reduced, h -> {
                    HeaderKeys.put(h, HeaderKeys.ASTROMETRY, true, "Plate solved");
                    HeaderKeys.put(h, "CRVAL1", p.ra(), "RA of reference point (deg)");
                    HeaderKeys.put(h, "CRVAL2", p.dec(), "DEC of reference point (deg)");
                });
                ctx.summary.platesSolved.incrementAndGet();
                log.info("Solved {}: RA {} DEC {}", reduced.getFileName(), p.ra(), p.dec());
            } catch (IOException e) {
                log.error("Plate solving {} failed: {}", reduced, e.getMessage());
                ctx.summary.fail(RunSummary.ErrorKind.PLATE_SOLVE, reduced, e);
            }
        }
    }
}
