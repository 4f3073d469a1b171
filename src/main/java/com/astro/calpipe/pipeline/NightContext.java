package com.astro.calpipe.pipeline;

import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.RunSummary;

/** State shared by the steps of one night run. */
public class NightContext {
    public final NightDirectory night;
    public final PipelineServices services;
    public final RunSummary summary;

    public NightContext(NightDirectory night, PipelineServices services, RunSummary summary) {
        this.night = night;
        this.services = services;
        this.summary = summary;
    }
}
