package com.reportkit.cli;

import com.reportkit.cli.command.ConfigCommand;
import com.reportkit.cli.command.FormatsCommand;
import com.reportkit.cli.command.RenderCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for ReportKit.
 */
@Command(
        name = "reportkit",
        description = "Render tabular data as text, Markdown, HTML, PDF or JSON reports",
        version = "1.0.0",
        mixinStandardHelpOptions = true,
        subcommands = {
                RenderCommand.class,
                FormatsCommand.class,
                ConfigCommand.class
        }
)
public class ReportKitCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand is specified, print help
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line with all subcommands, configured the way {@link #main} runs it.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new ReportKitCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                // Repeated switches and summary options are applied in order
                .setOverwrittenOptionsAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
