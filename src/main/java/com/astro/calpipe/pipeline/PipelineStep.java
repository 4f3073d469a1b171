package com.astro.calpipe.pipeline;

import com.astro.calpipe.error.CalPipeException;
import java.io.IOException;
import java.util.Set;

/**
 * One processing step of a night run. Per-frame failures are recorded in the context's summary;
 * an exception means the step as a whole could not run.
 */
public interface PipelineStep {

    /** Name used in {@code pipeline.steps} and {@code --steps}. */
    String name();

    Set<Product> requires();

    Set<Product> provides();

    void run(NightContext context) throws CalPipeException, IOException;
}
