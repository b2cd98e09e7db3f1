package com.flagship.statement_importer.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Runs {@link ImportCommand} once the application context is ready and keeps its
 * exit code for {@code SpringApplication.exit}.
 */
@Component
@ConditionalOnProperty(name = "importer.cli.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ImportRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ImportCommand importCommand;

    private int exitCode;

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(importCommand);
        commandLine.getCommandSpec().version(importCommand.versionLine());
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
