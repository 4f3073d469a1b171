package com.astro.calpipe.main;

import com.astro.calpipe.model.PipelineConfig;
import com.astro.calpipe.model.RunSummary;
import com.astro.calpipe.pipeline.PipelineServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "pending",
        description = "Re-evaluate every pending ledger entry once.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class
)
final class PendingCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PendingCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-c", "--config"}, description = "TOML configuration (default: ./calpipe.toml if present).")
    Path config;

    @CommandLine.Option(names = "--ledger", description = "Ledger file, overriding paths.pending_log.")
    Path ledger;

    @CommandLine.Option(names = "--today", paramLabel = "yyyy-MM-dd", description = "Date the pass runs as (default: today).")
    String today;

    @Override
    public Integer call() throws Exception {
        PipelineConfig cfg = PipelineConfig.loadOrDefaults(config);
        if (ledger != null) cfg.setPendingLog(ledger);
        if (!cfg.hasLedgerLocation()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "No ledger location: pass --ledger or set paths.pending_log or paths.data_root");
        }
        log.info("Using ledger {}", cfg.getPendingLog().toAbsolutePath());

        RunSummary summary;
        try (PipelineServices services = new PipelineServices(cfg)) {
            summary = services.pendingPass(clock()).run();
        }
        spec.commandLine().getOut().println(summary);
        for (RunSummary.Failure f : summary.failures()) {
            spec.commandLine().getOut().println("  " + f);
        }
        return summary.exitCode();
    }

    private Clock clock() {
        if (today == null) return Clock.systemDefaultZone();
        try {
            ZoneId zone = ZoneId.systemDefault();
            return Clock.fixed(LocalDate.parse(today).atStartOfDay(zone).toInstant(), zone);
        } catch (DateTimeParseException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--today must be yyyy-MM-dd: " + today);
        }
    }
}
