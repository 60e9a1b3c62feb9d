package com.sitesmith.dispatch.cli;

import com.sitesmith.core.model.Project;
import com.sitesmith.core.model.SortOrder;
import com.sitesmith.core.store.ProjectStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: sitesmith projects
 * <p>
 * Lists projects as a table: ID | DOMAIN | VERSIONS | DEPLOYED | CREATED.
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List projects")
@Component
public class ProjectsCommand implements Runnable {

    @Option(names = {"--page", "-p"}, description = "Page number, 1-based", defaultValue = "1")
    int page;

    @Option(names = {"--limit", "-n"}, description = "Projects per page", defaultValue = "10")
    int limit;

    @Option(names = "--sort", description = "asc or desc by creation time", defaultValue = "desc")
    String sort;

    private final ProjectStore store;

    public ProjectsCommand(ProjectStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var result = store.list(page, limit, SortOrder.parse(sort));
        if (result.totalCount() == 0) {
            ConsoleOutput.info("No projects found.");
            return;
        }

        ConsoleOutput.info("Projects (page " + result.page() + " of " + result.totalPages()
                + ", " + result.totalCount() + " total):");
        System.out.println();
        System.out.printf("  %-36s %-40s %-8s %-8s %s%n", "ID", "DOMAIN", "VERSIONS", "DEPLOYED", "CREATED");
        System.out.println("  " + "-".repeat(118));
        for (Project p : result.items()) {
            System.out.printf("  %-36s %-40s %-8d %-8s %s%n",
                    p.id(),
                    ConsoleOutput.truncate(p.domain(), 40),
                    p.versions().size(),
                    p.deployedIndex() == null ? "-" : String.valueOf(p.deployedIndex()),
                    p.createdAt());
        }
    }
}
