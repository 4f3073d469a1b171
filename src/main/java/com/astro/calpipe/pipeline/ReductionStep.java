package com.astro.calpipe.pipeline;

import com.astro.calpipe.error.LedgerLockException;
import com.astro.calpipe.error.MissingMandatoryCalibrationException;
import com.astro.calpipe.model.LightFrame;
import com.astro.calpipe.model.NightIndex;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.ReducedFrame;
import com.astro.calpipe.model.ReductionStatus;
import com.astro.calpipe.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces every light frame of the night and logs the ones whose calibration is not final.
 * Frames reduced with same-night masters only are not touched in the ledger; stale rows for
 * them are cleared by the next pending pass.
 */
public class ReductionStep implements PipelineStep {
    private static final Logger log = LoggerFactory.getLogger(ReductionStep.class);

    @Override
    public String name() {
        return "reduction";
    }

    @Override
    public Set<Product> requires() {
        return EnumSet.of(Product.RAW_FRAMES, Product.MASTER_FRAMES);
    }

    @Override
    public Set<Product> provides() {
        return EnumSet.of(Product.REDUCED_FRAMES);
    }

    @Override
    public void run(NightContext ctx) throws IOException {
        PipelineServices s = ctx.services;
        NightIndex index = s.index.index(ctx.night);
        List<PendingEntry> pending = new ArrayList<>();

        for (LightFrame light : index.lightFrames()) {
            if (s.config.isSkipReduced() && light.status == ReductionStatus.REDUCED) {
                log.debug("Skipping {}, already reduced", light.fileName());
                continue;
            }
            try {
                ReducedFrame reduced = s.reduction.reduce(ctx.night, light);
                ctx.summary.lightsReduced.incrementAndGet();
                PendingEntry entry = s.reduction.followUp(ctx.night, reduced);
                if (entry != null) pending.add(entry);
            } catch (MissingMandatoryCalibrationException e) {
                log.error("Not reducing {}: {}", light.fileName(), e.getMessage());
                ctx.summary.fail(RunSummary.ErrorKind.MISSING_MANDATORY_CALIBRATION, light.path, e);
                e.pendingEntry().ifPresent(pending::add);
            } catch (IOException e) {
                log.error("Reduction of {} failed: {}", light.path, e.getMessage());
                ctx.summary.fail(RunSummary.ErrorKind.IO, light.path, e);
            }
        }

        if (!pending.isEmpty()) {
            try {
                s.ledger.upsert(pending);
                ctx.summary.pendingLogged.addAndGet(pending.size());
            } catch (LedgerLockException e) {
                log.error("Could not log {} pending frames: {}", pending.size(), e.getMessage());
                ctx.summary.fail(RunSummary.ErrorKind.LEDGER_LOCK, s.ledger.file(), e);
            }
        }
    }
}
