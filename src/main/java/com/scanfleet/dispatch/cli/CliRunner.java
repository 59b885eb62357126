package com.scanfleet.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to {@link ScanfleetCommand}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ScanfleetCommand scanfleetCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ScanfleetCommand scanfleetCommand, IFactory factory) {
        this.scanfleetCommand = scanfleetCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(scanfleetCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
