package com.synergi.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Synergi.
 */
@Command(
        name = "synergi",
        mixinStandardHelpOptions = true,
        version = "Synergi 0.1.0",
        description = "Plans tasks, hires paid workers under a budget and settles every payment",
        subcommands = {
                TaskCommand.class,
                RegistryCommand.class,
                LedgerCommand.class,
                WatchCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SynergiCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // usage from the live command tree; subcommands are built by the Spring factory
        spec.commandLine().usage(System.out);
    }
}
