package com.astro.calpipe.pipeline;

import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.pending.PendingLedger;
import com.astro.calpipe.pending.PendingPassService;
import com.astro.calpipe.service.BackupService;
import com.astro.calpipe.service.ClusterService;
import com.astro.calpipe.service.FitsHeaderService;
import com.astro.calpipe.service.FitsImageService;
import com.astro.calpipe.service.FrameIndexService;
import com.astro.calpipe.service.FrameMatcherService;
import com.astro.calpipe.service.MasterFrameService;
import com.astro.calpipe.service.PlateSolveService;
import com.astro.calpipe.service.ReductionService;
import com.astro.calpipe.service.combine.CombineMethod;
import com.astro.calpipe.service.combine.CombineStrategy;
import java.time.Clock;

/** Wires the services of one run from a configuration. Closing it stops the build pool. */
public class PipelineServices implements AutoCloseable {
    public final PipelineConfig config;
    public final FitsImageService images;
    public final FrameIndexService index;
    public final ClusterService clusters;
    public final FrameMatcherService matcher;
    public final MasterFrameService masters;
    public final ReductionService reduction;
    public final PendingLedger ledger;
    public final BackupService backup;
    public final PlateSolveService plateSolver;

    public PipelineServices(PipelineConfig config) {
        this(config, CombineMethod.strategy(config.getCombine(), config.getSigma()));
    }

    public PipelineServices(PipelineConfig config, CombineStrategy strategy) {
        this.config = config;
        this.images = new FitsImageService();
        this.index = new FrameIndexService(new FitsHeaderService());
        this.clusters = new ClusterService(config.gap(), config.getMinFrames());
        this.matcher = new FrameMatcherService(index, config.getMaxSearchDays());
        this.masters = new MasterFrameService(config, images, index, matcher, strategy);
        this.reduction = new ReductionService(config, images, matcher);
        this.ledger = new PendingLedger(config.getPendingLog(), config.getLockRetries(), config.getLockBackoff());
        this.backup = new BackupService(images, config.getTelescopeRoot());
        this.plateSolver = new PlateSolveService(config.getAstapPath(), config.getAstapDbPath(), config.getAstrometryTimeout());
    }

    public PendingPassService pendingPass(Clock clock) {
        return new PendingPassService(ledger, index, masters, reduction, config.getMaxSearchDays(), clock);
    }

    @Override
    public void close() {
        masters.close();
    }
}
