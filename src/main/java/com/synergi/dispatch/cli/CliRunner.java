package com.synergi.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SynergiCommand synergiCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SynergiCommand synergiCommand, IFactory factory) {
        this.synergiCommand = synergiCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve: the embedded web server keeps the JVM alive, picocli would return immediately
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(synergiCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
