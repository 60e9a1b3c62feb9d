package com.sitesmith.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitesmith.core.deploy.DeploymentCoordinator;
import com.sitesmith.core.deploy.TeardownResult;
import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.generation.WebsiteGenerationService;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.model.SortOrder;
import com.sitesmith.core.store.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the project lifecycle.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectStore store;
    private final DeploymentCoordinator deployments;
    private final WebsiteGenerationService generation;

    public ProjectController(ProjectStore store,
                             DeploymentCoordinator deployments,
                             WebsiteGenerationService generation) {
        this.store = store;
        this.deployments = deployments;
        this.generation = generation;
    }

    /**
     * POST /api/v1/projects: allocate a domain and create an empty project.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create() {
        Project project = deployments.createProject();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Project created");
        body.put("id", project.id());
        body.put("domain", project.domain());
        body.put("createdAt", project.createdAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * GET /api/v1/projects?page=1&amp;limit=10&amp;sort=desc
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(defaultValue = "10") int limit,
                                                    @RequestParam(defaultValue = "desc") String sort) {
        var result = store.list(page, limit, SortOrder.parse(sort));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projects", result.items());
        body.put("page", result.page());
        body.put("limit", result.pageSize());
        body.put("totalCount", result.totalCount());
        body.put("totalPages", result.totalPages());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        Project project = store.get(id).orElseThrow(() -> NotFoundException.project(id));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("project", project);
        return ResponseEntity.ok(body);
    }

    /**
     * DELETE /api/v1/projects/{id}: best-effort external cleanup, then record removal.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<TeardownResult> delete(@PathVariable String id) {
        TeardownResult result = deployments.deleteProject(id);
        log.info("Teardown of {} via API: {}", id, result.message());
        return ResponseEntity.ok(result);
    }

    /**
     * PUT /api/v1/projects/{id}/conversation: replace the stored chat transcript.
     */
    @PutMapping("/{id}/conversation")
    public ResponseEntity<Map<String, Object>> saveConversation(@PathVariable String id,
                                                                @RequestBody JsonNode transcript) {
        generation.saveConversation(id, transcript);
        return ResponseEntity.ok(Map.of("success", true));
    }
}
