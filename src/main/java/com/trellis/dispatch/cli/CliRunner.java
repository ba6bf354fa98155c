package com.trellis.dispatch.cli;

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

    private final TrellisCommand trellisCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TrellisCommand trellisCommand, IFactory factory) {
        this.trellisCommand = trellisCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return at once.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(trellisCommand, factory).execute(args);
    }

    static boolean isServeMode(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
