package com.tandem.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TandemCommand tandemCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TandemCommand tandemCommand, IFactory factory) {
        this.tandemCommand = tandemCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // Spring property overrides (--tandem.repo-path=...) are consumed by Spring, not picocli.
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--tandem.") && !arg.startsWith("--spring.")
                        && !arg.startsWith("--logging."))
                .toArray(String[]::new);
        exitCode = new CommandLine(tandemCommand, factory).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
