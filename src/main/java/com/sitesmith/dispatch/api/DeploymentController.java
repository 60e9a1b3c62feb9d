package com.sitesmith.dispatch.api;

import com.sitesmith.core.deploy.DeploymentCoordinator;
import com.sitesmith.core.deploy.PublishResult;
import com.sitesmith.core.error.ValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for publishing a version to the project's domain.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/deploy")
public class DeploymentController {

    private final DeploymentCoordinator deployments;

    public DeploymentController(DeploymentCoordinator deployments) {
        this.deployments = deployments;
    }

    @PutMapping
    public ResponseEntity<PublishResult> deploy(@PathVariable String projectId,
                                                @RequestBody DeployRequest request) {
        if (request.versionIndex() == null) {
            throw new ValidationException("Invalid versionIndex");
        }
        return ResponseEntity.ok(deployments.publish(projectId, request.versionIndex()));
    }
}
