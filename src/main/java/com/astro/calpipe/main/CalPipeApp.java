package com.astro.calpipe.main;

import picocli.CommandLine;

/**
 * Entry point: {@code calpipe night <dir>} for a night run, {@code calpipe pending} for the
 * periodic ledger pass.
 */
@CommandLine.Command(
        name = "calpipe",
        description = "Calibrates and reduces telescope nights, and re-reduces frames as better masters appear.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class,
        subcommands = {NightCommand.class, PendingCommand.class, CommandLine.HelpCommand.class}
)
public class CalPipeApp implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command: night or pending");
    }

    public static CommandLine commandLine() {
        return new CommandLine(new CalPipeApp())
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
