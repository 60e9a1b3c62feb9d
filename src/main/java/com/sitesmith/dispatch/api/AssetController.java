package com.sitesmith.dispatch.api;

import com.sitesmith.core.asset.AssetRegistry;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.model.Asset;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for image assets attached to a project.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/assets")
public class AssetController {

    private final AssetRegistry assets;

    public AssetController(AssetRegistry assets) {
        this.assets = assets;
    }

    @GetMapping
    public ResponseEntity<List<Asset>> list(@PathVariable String projectId) {
        return ResponseEntity.ok(assets.listAssets(projectId));
    }

    /**
     * POST (multipart, part {@code file}): upload and ingest one image.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> upload(@PathVariable String projectId,
                                                      @RequestParam("file") MultipartFile file) {
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new ValidationException("Could not read uploaded file", e);
        }
        Asset asset = assets.ingest(projectId, bytes, file.getOriginalFilename(), file.getContentType());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "asset", asset));
    }

    @DeleteMapping("/{assetId}")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable String projectId, @PathVariable String assetId) {
        assets.remove(projectId, assetId);
        return ResponseEntity.ok(Map.of("success", true));
    }
}
