package com.astro.calpipe.pipeline;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;

public class BackupStep implements PipelineStep {

    @Override
    public String name() {
        return "backup";
    }

    @Override
    public Set<Product> requires() {
        return EnumSet.noneOf(Product.class);
    }

    @Override
    public Set<Product> provides() {
        return EnumSet.of(Product.RAW_FRAMES);
    }

    @Override
    public void run(NightContext context) throws IOException {
        context.services.backup.backup(context.night);
    }
}
