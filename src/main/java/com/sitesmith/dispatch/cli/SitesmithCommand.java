package com.sitesmith.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Sitesmith.
 */
@Command(
        name = "sitesmith",
        mixinStandardHelpOptions = true,
        version = "Sitesmith 0.1.0",
        description = "Generate, version and publish single-page websites",
        subcommands = {
                ServeCommand.class,
                ProjectsCommand.class,
                ShowCommand.class,
                PublishCommand.class,
                DeleteCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SitesmithCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
