package com.sitesmith.dispatch.cli;

import com.sitesmith.core.model.Asset;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.store.ProjectStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sitesmith show &lt;projectId&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show one project's versions and assets")
@Component
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    String projectId;

    private final ProjectStore store;

    public ShowCommand(ProjectStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var found = store.get(projectId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Project not found: " + projectId);
            return 1;
        }
        var project = found.get();
        ConsoleOutput.info("Project " + project.id());
        System.out.println("  Domain:   https://" + project.domain());
        System.out.println("  Created:  " + project.createdAt());
        System.out.println("  Versions: " + project.versions().size()
                + (project.deployedIndex() == null ? " (none deployed)" : " (deployed: " + project.deployedIndex() + ")"));
        for (int i = 0; i < project.versions().size(); i++) {
            HtmlVersion v = project.versions().get(i);
            ConsoleOutput.version(i, v.id() + "  " + v.createdAt(),
                    project.deployedIndex() != null && project.deployedIndex() == i);
        }
        System.out.println("  Assets:   " + project.assets().size());
        for (Asset a : project.assets()) {
            System.out.println("    " + a.filename() + "  " + a.url());
        }
        return 0;
    }
}
