package com.sitesmith.dispatch.api;

import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.core.version.Direction;
import com.sitesmith.core.version.VersionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
 * REST controller for a project's HTML version history.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/versions")
public class VersionController {

    private final ProjectStore store;
    private final VersionManager versions;

    public VersionController(ProjectStore store, VersionManager versions) {
        this.store = store;
        this.versions = versions;
    }

    /**
     * POST: append a new version. Never publishes.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> append(@PathVariable String projectId,
                                                      @RequestBody HtmlRequest request) {
        HtmlVersion version = versions.appendVersion(projectId, request.html());
        int index = versions.indexOf(projectId, version.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(versionBody(version, index));
    }

    /**
     * PUT /{index}: overwrite the content of an existing version in place.
     */
    @PutMapping("/{index}")
    public ResponseEntity<Map<String, Object>> editInPlace(@PathVariable String projectId,
                                                           @PathVariable int index,
                                                           @RequestBody HtmlRequest request) {
        HtmlVersion version = versions.editVersionInPlace(projectId, index, request.html());
        return ResponseEntity.ok(versionBody(version, index));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@PathVariable String projectId) {
        Project project = require(projectId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("versions", project.versions());
        body.put("deployedIndex", project.deployedIndex());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /current: the deployed version, else the latest one.
     */
    @GetMapping("/current")
    public ResponseEntity<HtmlVersion> current(@PathVariable String projectId) {
        return ResponseEntity.ok(versions.currentVersion(require(projectId))
                .orElseThrow(() -> new NotFoundException("Project " + projectId + " has no versions")));
    }

    /**
     * GET /navigate?from=2&amp;direction=previous: the neighbouring index, clamped to the history.
     */
    @GetMapping("/navigate")
    public ResponseEntity<Map<String, Object>> navigate(@PathVariable String projectId,
                                                        @RequestParam int from,
                                                        @RequestParam String direction) {
        Project project = require(projectId);
        int index = versions.navigate(project, from, Direction.parse(direction));
        return ResponseEntity.ok(versionBody(project.versions().get(index), index));
    }

    @GetMapping("/{versionId}")
    public ResponseEntity<HtmlVersion> get(@PathVariable String projectId, @PathVariable String versionId) {
        return ResponseEntity.ok(versions.getVersion(projectId, versionId)
                .orElseThrow(() -> new NotFoundException("Version not found: " + versionId)));
    }

    private Project require(String projectId) {
        return store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
    }

    private static Map<String, Object> versionBody(HtmlVersion version, int index) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("versionId", version.id());
        body.put("versionIndex", index);
        body.put("createdAt", version.createdAt());
        return body;
    }
}
