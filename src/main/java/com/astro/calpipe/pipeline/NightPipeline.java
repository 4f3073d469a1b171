package com.astro.calpipe.pipeline;

import com.astro.calpipe.error.CalPipeException;
import com.astro.calpipe.error.PipelinePlanException;
import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Runs a validated plan of steps over one night. */
public class NightPipeline {
    private static final Logger log = LoggerFactory.getLogger(NightPipeline.class);

    private final PipelineServices services;
    private final Map<String, PipelineStep> available;

    public NightPipeline(PipelineServices services) {
        this(services, PipelinePlan.standardSteps());
    }

    public NightPipeline(PipelineServices services, Map<String, PipelineStep> available) {
        this.services = services;
        this.available = available;
    }

    public PipelinePlan plan(NightDirectory night, List<String> stepNames) throws PipelinePlanException, IOException {
        return PipelinePlan.of(stepNames, available, PipelinePlan.onDisk(night));
    }

    /**
     * Validates the plan, then runs each step in order. A step that fails as a whole is recorded
     * and the remaining steps still run on whatever is on disk.
     */
    public RunSummary run(NightDirectory night, List<String> stepNames) throws PipelinePlanException, IOException {
        PipelinePlan plan = plan(night, stepNames);
        RunSummary summary = new RunSummary();
        NightContext ctx = new NightContext(night, services, summary);
        log.info("Night {}: {}", night.name(), plan);
        for (PipelineStep step : plan.steps()) {
            long start = System.currentTimeMillis();
            try {
                step.run(ctx);
                log.info("Step {} done in {} ms", step.name(), System.currentTimeMillis() - start);
            } catch (CalPipeException | IOException e) {
                log.error("Step {} failed: {}", step.name(), e.getMessage());
                summary.fail(RunSummary.ErrorKind.IO, step.name(), e);
            }
        }
        log.info("Night {} finished: {}", night.name(), summary);
        return summary;
    }
}
