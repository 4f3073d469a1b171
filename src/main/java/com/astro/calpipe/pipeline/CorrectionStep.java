package com.astro.calpipe.pipeline;

import com.astro.calpipe.error.LedgerLockException;
import com.astro.calpipe.model.ClusterKey;
import com.astro.calpipe.model.FrameCluster;
import com.astro.calpipe.model.MasterFrame;
import com.astro.calpipe.model.NightIndex;
import com.astro.calpipe.model.PendingEntry;
import com.astro.calpipe.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Clusters the night's calibration frames and builds one master per cluster. */
public class CorrectionStep implements PipelineStep {
    private static final Logger log = LoggerFactory.getLogger(CorrectionStep.class);

    @Override
    public String name() {
        return "correction";
    }

    @Override
    public Set<Product> requires() {
        return EnumSet.of(Product.RAW_FRAMES);
    }

    @Override
    public Set<Product> provides() {
        return EnumSet.of(Product.MASTER_FRAMES);
    }

    @Override
    public void run(NightContext ctx) throws IOException {
        PipelineServices s = ctx.services;
        NightIndex index = s.index.index(ctx.night);
        index.unreadable().forEach((path, reason) -> ctx.summary.fail(RunSummary.ErrorKind.IO, path, reason));

        Map<ClusterKey, List<FrameCluster>> clusters = s.clusters.clusterAll(index.calibrationFrames());
        clusters.forEach((key, list) -> list.forEach(c -> log.info("Cluster {}", c)));

        List<PendingEntry> pending = new ArrayList<>();
        List<MasterFrame> built = s.masters.buildNight(ctx.night, clusters, ctx.summary, pending);
        log.info("Built {} masters for {}", built.size(), ctx.night.name());

        if (!pending.isEmpty()) {
            try {
                s.ledger.upsert(pending);
                ctx.summary.pendingLogged.addAndGet(pending.size());
            } catch (LedgerLockException e) {
                log.error("Could not log {} pending masters: {}", pending.size(), e.getMessage());
                ctx.summary.fail(RunSummary.ErrorKind.LEDGER_LOCK, s.ledger.file(), e);
            }
        }
    }
}
