package com.sitesmith.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SitesmithCommand sitesmithCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SitesmithCommand sitesmithCommand, IFactory factory) {
        this.sitesmithCommand = sitesmithCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve mode: the embedded web server owns the process
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(sitesmithCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
