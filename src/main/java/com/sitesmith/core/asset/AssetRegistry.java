package com.sitesmith.core.asset;

import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.error.UnsupportedMediaTypeException;
import com.sitesmith.core.error.UpstreamUnavailableException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.logging.MdcContext;
import com.sitesmith.core.metrics.SitesmithMetrics;
import com.sitesmith.core.model.Asset;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.core.store.ProjectUpdate;
import com.sitesmith.core.upstream.UpstreamCalls;
import com.sitesmith.storage.ObjectStore;
import com.sitesmith.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives asset records from uploaded images and keeps them in step with the
 * object store.
 *
 * <p>An upload is validated, measured, captioned, re-encoded with its
 * description embedded, written to the object store and only then recorded on
 * the project. Removal runs the other way: object first, record second.
 */
@Service
public class AssetRegistry {

    private static final Logger log = LoggerFactory.getLogger(AssetRegistry.class);

    private final ProjectStore store;
    private final ObjectStore objectStore;
    private final StorageKeys keys;
    private final ImageInspector inspector;
    private final ImageNormalizer normalizer;
    private final CaptionService captionService;
    private final UpstreamCalls upstreamCalls;
    private final AssetProperties properties;
    private final SitesmithMetrics metrics;
    private final Clock clock;
    private final Set<String> pendingFilenames = ConcurrentHashMap.newKeySet();

    public AssetRegistry(ProjectStore store,
                         ObjectStore objectStore,
                         StorageKeys keys,
                         ImageInspector inspector,
                         ImageNormalizer normalizer,
                         CaptionService captionService,
                         UpstreamCalls upstreamCalls,
                         AssetProperties properties,
                         SitesmithMetrics metrics,
                         Clock clock) {
        this.store = store;
        this.objectStore = objectStore;
        this.keys = keys;
        this.inspector = inspector;
        this.normalizer = normalizer;
        this.captionService = captionService;
        this.upstreamCalls = upstreamCalls;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Ingests one uploaded image.
     *
     * @throws UnsupportedMediaTypeException when the declared type is not PNG, JPEG, GIF or WebP
     * @throws ValidationException           when the bytes cannot be decoded
     * @throws UpstreamUnavailableException  when the upload fails; nothing is recorded
     * @throws NotFoundException             when the project does not exist or vanished during the upload
     */
    public Asset ingest(String projectId, byte[] content, String originalFilename, String declaredContentType) {
        SupportedImageType type = SupportedImageType.fromContentType(declaredContentType)
                .orElseThrow(() -> new UnsupportedMediaTypeException(declaredContentType));
        if (content == null || content.length == 0) {
            throw new ValidationException("No file uploaded");
        }
        Project project = require(projectId);

        try (var mdc = MdcContext.open(projectId, "asset-ingest")) {
            ImageGeometry geometry = inspector.inspect(content);
            String description = caption(content, type) + "\n" + geometry.describe();
            String filename = reserveFilename(projectId, sanitize(originalFilename, type), type);
            try {
                return upload(project, filename, content, type, description, geometry);
            } finally {
                pendingFilenames.remove(pendingKey(projectId, filename));
            }
        }
    }

    private Asset upload(Project project, String filename, byte[] content, SupportedImageType type,
                         String description, ImageGeometry geometry) {
        String projectId = project.id();
        NormalizedImage normalized = normalizer.normalize(content, type, filename, description);
        String key = keys.asset(project.domain(), normalized.filename());
        objectStore.put(key, normalized.content(), normalized.contentType());

        var asset = new Asset(
                UUID.randomUUID().toString(),
                "https://" + project.domain() + "/assets/" + normalized.filename(),
                normalized.filename(),
                Instant.now(clock),
                normalized.contentType(),
                description);

        boolean recorded = store.withLock(projectId, () -> {
            var current = store.get(projectId);
            if (current.isEmpty()) {
                return false;
            }
            var assets = new ArrayList<>(current.get().assets());
            assets.add(asset);
            store.update(projectId, ProjectUpdate.assets(assets));
            return true;
        });
        if (!recorded) {
            discardOrphan(key);
            throw NotFoundException.project(projectId);
        }

        metrics.recordAssetIngested(type.contentType());
        log.info("Ingested asset {} as {} ({}x{}, {})", asset.id(), key,
                geometry.width(), geometry.height(), geometry.orientation());
        return asset;
    }

    /**
     * Deletes the stored object, then the record. A failed object deletion keeps
     * the record so the removal can be retried.
     */
    public void remove(String projectId, String assetId) {
        Project project = require(projectId);
        Asset asset = project.findAsset(assetId)
                .orElseThrow(() -> new NotFoundException("Asset not found: " + assetId));

        objectStore.delete(keys.asset(project.domain(), asset.filename()));

        store.withLock(projectId, () -> {
            store.get(projectId).ifPresent(current -> {
                var remaining = current.assets().stream().filter(a -> !a.id().equals(assetId)).toList();
                store.update(projectId, ProjectUpdate.assets(remaining));
            });
            return null;
        });
        log.info("Removed asset {} ({}) from project {}", assetId, asset.filename(), projectId);
    }

    public List<Asset> listAssets(String projectId) {
        return require(projectId).assets();
    }

    private String caption(byte[] content, SupportedImageType type) {
        try {
            String text = upstreamCalls.call("captioner",
                    Duration.ofSeconds(properties.getCaptionTimeoutSeconds()),
                    () -> captionService.caption(content, type.contentType()));
            if (text != null && !text.isBlank()) {
                return text.trim();
            }
            log.warn("Captioner returned no text; using placeholder");
        } catch (UpstreamUnavailableException e) {
            log.warn("Caption generation failed, using placeholder: {}", e.getMessage());
        }
        metrics.recordCaptionFallback();
        return properties.getCaptionPlaceholder();
    }

    private void discardOrphan(String key) {
        try {
            objectStore.delete(key);
        } catch (UpstreamUnavailableException e) {
            log.warn("Could not remove orphaned upload {}: {}", key, e.getMessage());
        }
    }

    /** Strips any client-side path and falls back to a generated name. */
    static String sanitize(String originalFilename, SupportedImageType type) {
        String name = originalFilename == null ? "" : originalFilename.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isEmpty() || name.startsWith(".")) {
            name = "image-" + UUID.randomUUID().toString().substring(0, 8) + "." + type.extension();
        }
        return name;
    }

    /**
     * Picks the stored name for an upload and holds it until the upload is
     * recorded or abandoned. A name already used by a recorded asset or by an
     * upload still in flight gets a random suffix, so every record keeps its
     * own object.
     */
    private String reserveFilename(String projectId, String requested, SupportedImageType type) {
        String target = type == SupportedImageType.PNG ? requested : ImageNormalizer.withExtension(requested, "png");
        return store.withLock(projectId, () -> {
            Project current = require(projectId);
            String candidate = target;
            while (isTaken(current, candidate)) {
                candidate = suffixed(target);
            }
            pendingFilenames.add(pendingKey(projectId, candidate));
            return candidate;
        });
    }

    private boolean isTaken(Project project, String filename) {
        return pendingFilenames.contains(pendingKey(project.id(), filename))
                || project.assets().stream().anyMatch(a -> a.filename().equals(filename));
    }

    private static String suffixed(String filename) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String ext = dot > 0 ? filename.substring(dot) : "";
        return stem + "-" + UUID.randomUUID().toString().substring(0, 8) + ext;
    }

    private static String pendingKey(String projectId, String filename) {
        return projectId + "/" + filename;
    }

    private Project require(String projectId) {
        return store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
    }
}
