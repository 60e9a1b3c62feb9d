package com.sitesmith.core.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitesmith.core.deploy.DeploymentCoordinator;
import com.sitesmith.core.deploy.PublishResult;
import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.error.SitesmithException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.logging.MdcContext;
import com.sitesmith.core.model.Asset;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.core.store.ProjectUpdate;
import com.sitesmith.core.upstream.UpstreamCalls;
import com.sitesmith.core.version.VersionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The operations a chat front end calls as tools: author a site, revise it or
 * one of its sections, and read back an earlier version.
 *
 * <p>Each generation step appends exactly one version. With auto-publish on,
 * that version is then published; a failed publish is reported in the result
 * and leaves the appended version in place.
 */
@Service
public class WebsiteGenerationService {

    private static final Logger log = LoggerFactory.getLogger(WebsiteGenerationService.class);

    private final ProjectStore store;
    private final VersionManager versions;
    private final DeploymentCoordinator deployments;
    private final TextGenerator generator;
    private final UpstreamCalls upstreamCalls;
    private final GenerationProperties properties;

    public WebsiteGenerationService(ProjectStore store,
                                    VersionManager versions,
                                    DeploymentCoordinator deployments,
                                    TextGenerator generator,
                                    UpstreamCalls upstreamCalls,
                                    GenerationProperties properties) {
        this.store = store;
        this.versions = versions;
        this.deployments = deployments;
        this.generator = generator;
        this.upstreamCalls = upstreamCalls;
        this.properties = properties;
    }

    public GenerationResult createWebsite(String projectId, String instructions, String context, List<String> assetIds) {
        requireInstructions(instructions);
        Project project = require(projectId);
        List<Asset> selected = selectAssets(project, assetIds);

        try (var mdc = MdcContext.open(projectId, "create-website")) {
            String html = generate(() -> generator.generate(null, instructions, context, refs(selected)));
            return store(projectId, html, selected, "Website created successfully!");
        }
    }

    /**
     * Revises the document at {@code versionId}, or the current version when no
     * id is given.
     *
     * @throws ValidationException when the project has no version to start from
     * @throws NotFoundException   when {@code versionId} does not exist
     */
    public GenerationResult updateWebsite(String projectId, String instructions, String context,
                                          String targetSection, String versionId, List<String> assetIds) {
        requireInstructions(instructions);
        Project project = require(projectId);
        HtmlVersion base;
        if (versionId != null && !versionId.isBlank()) {
            base = project.findVersion(versionId)
                    .orElseThrow(() -> new NotFoundException("Version with ID " + versionId + " not found."));
        } else {
            base = versions.currentVersion(project).orElseThrow(() -> new ValidationException(
                    "No existing website found to update. Please use createWebsite instead."));
        }
        List<Asset> selected = selectAssets(project, assetIds);
        boolean sectional = targetSection != null && !targetSection.isBlank();

        try (var mdc = MdcContext.open(projectId, "update-website")) {
            String html = generate(() -> sectional
                    ? generator.patchSection(base.content(), targetSection, instructions, context, refs(selected))
                    : generator.generate(base.content(), instructions, context, refs(selected)));
            String message = sectional
                    ? "Website section '" + targetSection + "' updated successfully!"
                    : "Website updated successfully!";
            return store(projectId, html, selected, message);
        }
    }

    public HtmlVersion getHtmlByVersion(String projectId, String versionId) {
        return versions.getVersion(projectId, versionId)
                .orElseThrow(() -> new NotFoundException("HTML version with ID " + versionId + " not found"));
    }

    /** Stores the chat transcript exactly as given. */
    public Project saveConversation(String projectId, JsonNode transcript) {
        if (transcript == null || transcript.isNull()) {
            throw new ValidationException("Conversation is required");
        }
        return store.withLock(projectId, () -> store.update(projectId, ProjectUpdate.conversation(transcript)))
                .orElseThrow(() -> NotFoundException.project(projectId));
    }

    private GenerationResult store(String projectId, String rawHtml, List<Asset> used, String message) {
        String html = HtmlFences.strip(rawHtml);
        if (html.isBlank()) {
            throw new ValidationException("Generator returned an empty document");
        }
        HtmlVersion version = versions.appendVersion(projectId, html);
        int index = versions.indexOf(projectId, version.id());
        List<String> usedIds = used.stream().map(Asset::id).toList();

        if (!properties.isAutoPublish()) {
            return new GenerationResult(true, message, version.id(), index, usedIds, null);
        }
        try {
            PublishResult published = deployments.publish(projectId, index);
            return new GenerationResult(true, message, version.id(), index, usedIds, published.url());
        } catch (SitesmithException e) {
            log.warn("Generated version {} stored but not published: {}", version.id(), e.getMessage());
            return new GenerationResult(true, message + " Publishing failed: " + e.getMessage(),
                    version.id(), index, usedIds, null);
        }
    }

    private String generate(Callable<String> work) {
        return upstreamCalls.call("text-generator", Duration.ofSeconds(properties.getTimeoutSeconds()), work);
    }

    private static List<Asset> selectAssets(Project project, List<String> assetIds) {
        if (assetIds == null || assetIds.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = assetIds.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        return project.assets().stream().filter(a -> wanted.contains(a.id())).toList();
    }

    private static List<AssetRef> refs(List<Asset> assets) {
        return assets.stream().map(AssetRef::from).toList();
    }

    private static void requireInstructions(String instructions) {
        if (instructions == null || instructions.isBlank()) {
            throw new ValidationException("Instructions are required");
        }
    }

    private Project require(String projectId) {
        return store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
    }
}
