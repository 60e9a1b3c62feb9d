package com.sitesmith.dispatch.api;

import com.sitesmith.core.generation.GenerationResult;
import com.sitesmith.core.generation.WebsiteGenerationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the website generation tools used by the chat front end.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/website")
public class GenerationController {

    private final WebsiteGenerationService generation;

    public GenerationController(WebsiteGenerationService generation) {
        this.generation = generation;
    }

    @PostMapping
    public ResponseEntity<GenerationResult> create(@PathVariable String projectId,
                                                   @RequestBody WebsiteRequest request) {
        var result = generation.createWebsite(projectId, request.instructions(), request.context(),
                request.assetIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/update")
    public ResponseEntity<GenerationResult> update(@PathVariable String projectId,
                                                   @RequestBody WebsiteRequest request) {
        var result = generation.updateWebsite(projectId, request.instructions(), request.context(),
                request.targetSection(), request.versionId(), request.assetIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
