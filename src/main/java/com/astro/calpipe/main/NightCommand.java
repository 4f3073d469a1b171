package com.astro.calpipe.main;

import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.pipeline.NightPipeline;
import com.astro.calpipe.pipeline.PipelineServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "night",
        description = "Run the configured steps (backup, correction, reduction, astrometry) for one night.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class
)
final class NightCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(NightCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Night directory, named yyMMdd.")
    Path nightDir;

    @CommandLine.Option(names = {"-c", "--config"}, description = "TOML configuration (default: ./calpipe.toml if present).")
    Path config;

    @CommandLine.Option(names = "--steps", split = ",", description = "Ordered steps, overriding pipeline.steps.")
    List<String> steps;

    @Override
    public Integer call() throws Exception {
        PipelineConfig cfg = PipelineConfig.loadOrDefaults(config);
        NightDirectory night = NightDirectory.of(nightDir);
        if (cfg.getDataRoot() == null) cfg.setDataRoot(night.root());
        List<String> plan = steps != null && !steps.isEmpty() ? steps : cfg.getSteps();

        RunSummary summary;
        try (PipelineServices services = new PipelineServices(cfg)) {
            summary = new NightPipeline(services).run(night, plan);
        }
        report(summary);
        return summary.exitCode();
    }

    private void report(RunSummary summary) {
        spec.commandLine().getOut().println(summary);
        for (RunSummary.Failure f : summary.failures()) {
            spec.commandLine().getOut().println("  " + f);
        }
        if (summary.errorCount() > 0) log.warn("{} failures in this run", summary.errorCount());
    }
}
