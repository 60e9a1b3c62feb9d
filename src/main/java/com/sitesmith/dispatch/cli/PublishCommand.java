package com.sitesmith.dispatch.cli;

import com.sitesmith.core.deploy.DeploymentCoordinator;
import com.sitesmith.core.error.SitesmithException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sitesmith publish &lt;projectId&gt; &lt;versionIndex&gt;
 */
@Command(name = "publish", mixinStandardHelpOptions = true, description = "Publish a version to the project's domain")
@Component
public class PublishCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    String projectId;

    @Parameters(index = "1", description = "Version index, 0-based")
    int versionIndex;

    private final DeploymentCoordinator deployments;

    public PublishCommand(DeploymentCoordinator deployments) {
        this.deployments = deployments;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var result = deployments.publish(projectId, versionIndex);
            ConsoleOutput.success("Version " + result.versionIndex() + " live at " + result.url());
            return 0;
        } catch (SitesmithException e) {
            ConsoleOutput.error(e.kind() + ": " + e.getMessage());
            return 1;
        }
    }
}
