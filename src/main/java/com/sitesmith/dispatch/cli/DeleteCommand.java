package com.sitesmith.dispatch.cli;

import com.sitesmith.core.deploy.DeploymentCoordinator;
import com.sitesmith.core.error.SitesmithException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sitesmith delete &lt;projectId&gt;
 * <p>
 * Exit code 0 when the project record is gone, even if some external cleanup
 * failed; the failed steps are listed.
 */
@Command(name = "delete", mixinStandardHelpOptions = true,
        description = "Delete a project, its published files and its domain")
@Component
public class DeleteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    String projectId;

    private final DeploymentCoordinator deployments;

    public DeleteCommand(DeploymentCoordinator deployments) {
        this.deployments = deployments;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            ConsoleOutput.teardown(deployments.deleteProject(projectId));
            return 0;
        } catch (SitesmithException e) {
            ConsoleOutput.error(e.kind() + ": " + e.getMessage());
            return 1;
        }
    }
}
