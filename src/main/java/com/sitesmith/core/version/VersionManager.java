package com.sitesmith.core.version;

import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.core.store.ProjectUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the version history of each project.
 *
 * <p>Versions are append-only. {@link #editVersionInPlace} is the single
 * deliberate exception: it rewrites the content of an existing entry without
 * adding one, and does not touch what is currently published.
 */
@Service
public class VersionManager {

    private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

    private final ProjectStore store;
    private final Clock clock;

    public VersionManager(ProjectStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Appends a new snapshot with a fresh id and the current time.
     *
     * @throws NotFoundException   when the project does not exist
     * @throws ValidationException when the content is blank
     */
    public HtmlVersion appendVersion(String projectId, String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("HTML content is required");
        }
        return store.withLock(projectId, () -> {
            Project project = require(projectId);
            var version = new HtmlVersion(UUID.randomUUID().toString(), content, Instant.now(clock));
            var versions = new ArrayList<>(project.versions());
            versions.add(version);
            store.update(projectId, ProjectUpdate.versions(versions));
            log.info("Appended version {} to project {} (index {})", version.id(), projectId, versions.size() - 1);
            return version;
        });
    }

    public Optional<HtmlVersion> getVersion(String projectId, String versionId) {
        return require(projectId).findVersion(versionId);
    }

    public List<HtmlVersion> listVersions(String projectId) {
        return require(projectId).versions();
    }

    /** Position of a version in the history; stable because versions are never removed. */
    public int indexOf(String projectId, String versionId) {
        var versions = listVersions(projectId);
        for (int i = 0; i < versions.size(); i++) {
            if (versions.get(i).id().equals(versionId)) {
                return i;
            }
        }
        throw new NotFoundException("Version not found: " + versionId);
    }

    /**
     * Overwrites the content of the version at {@code index}, keeping its id and
     * timestamp. Mutates history and never creates an entry. If the version is
     * the published one, the live site keeps the old content until the next
     * publish.
     */
    public HtmlVersion editVersionInPlace(String projectId, int index, String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("HTML content is required");
        }
        return store.withLock(projectId, () -> {
            Project project = require(projectId);
            if (!project.hasVersionIndex(index)) {
                throw new ValidationException("Invalid version index %d (project has %d versions)"
                        .formatted(index, project.versions().size()));
            }
            var versions = new ArrayList<>(project.versions());
            HtmlVersion edited = versions.get(index).withContent(content);
            versions.set(index, edited);
            store.update(projectId, ProjectUpdate.versions(versions));
            if (project.deployedIndex() != null && project.deployedIndex() == index) {
                log.warn("Edited published version {} of project {} in place; live site is unchanged until republished",
                        index, projectId);
            } else {
                log.info("Edited version {} of project {} in place", index, projectId);
            }
            return edited;
        });
    }

    /**
     * The version at the deployed index, else the most recently appended one,
     * else empty.
     */
    public Optional<HtmlVersion> currentVersion(Project project) {
        Integer deployed = project.deployedIndex();
        if (deployed != null && project.hasVersionIndex(deployed)) {
            return project.versionAt(deployed);
        }
        var versions = project.versions();
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    /**
     * Moves one step from {@code fromIndex}, saturating at both ends.
     *
     * @throws ValidationException when the project has no versions or {@code fromIndex} is out of range
     */
    public int navigate(Project project, int fromIndex, Direction direction) {
        int last = project.versions().size() - 1;
        if (last < 0) {
            throw new ValidationException("Project " + project.id() + " has no versions");
        }
        if (!project.hasVersionIndex(fromIndex)) {
            throw new ValidationException("Invalid version index %d (project has %d versions)"
                    .formatted(fromIndex, last + 1));
        }
        return switch (direction) {
            case PREVIOUS -> Math.max(0, fromIndex - 1);
            case NEXT -> Math.min(last, fromIndex + 1);
        };
    }

    private Project require(String projectId) {
        return store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
    }
}
