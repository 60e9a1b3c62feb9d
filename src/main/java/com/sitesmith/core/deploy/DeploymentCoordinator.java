package com.sitesmith.core.deploy;

import com.sitesmith.core.error.DeploymentFailedException;
import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.error.PersistenceFailedException;
import com.sitesmith.core.error.UpstreamUnavailableException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.logging.MdcContext;
import com.sitesmith.core.metrics.SitesmithMetrics;
import com.sitesmith.core.model.Asset;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.core.store.ProjectUpdate;
import com.sitesmith.registry.DomainRegistry;
import com.sitesmith.storage.ObjectStore;
import com.sitesmith.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves projects across the two external systems: the object store serving the
 * site and the registry that routes its domain.
 *
 * <p>This is the only component that changes a project's deployed index. A
 * publish writes the object first and commits the pointer second, so the
 * pointer never names a version the store did not accept. The object write is
 * not held under the project lock: two concurrent publishes on one project
 * each win one of the two steps independently, and the last pointer commit may
 * disagree with the last object write. The pointer commit re-reads the record
 * under the lock, so a teardown that lands during the write is followed by the
 * removal of the object the publish just wrote.
 */
@Service
public class DeploymentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentCoordinator.class);
    static final String HTML_CONTENT_TYPE = "text/html";

    private final ProjectStore store;
    private final ObjectStore objectStore;
    private final DomainRegistry domainRegistry;
    private final DomainNameGenerator domainNames;
    private final StorageKeys keys;
    private final SitesmithMetrics metrics;

    public DeploymentCoordinator(ProjectStore store,
                                 ObjectStore objectStore,
                                 DomainRegistry domainRegistry,
                                 DomainNameGenerator domainNames,
                                 StorageKeys keys,
                                 SitesmithMetrics metrics) {
        this.store = store;
        this.objectStore = objectStore;
        this.domainRegistry = domainRegistry;
        this.domainNames = domainNames;
        this.keys = keys;
        this.metrics = metrics;
    }

    /**
     * Allocates and registers a fresh domain, then records the project.
     *
     * @throws UpstreamUnavailableException when the registry refuses the domain; nothing is persisted
     * @throws PersistenceFailedException   when the record cannot be written; the domain is released
     */
    public Project createProject() {
        String domain = domainNames.generate();
        domainRegistry.register(domain);
        try {
            Project project = store.create(domain);
            metrics.recordProjectCreated();
            log.info("Project {} created with domain {}", project.id(), domain);
            return project;
        } catch (PersistenceFailedException e) {
            log.error("Could not record project for domain {}; releasing it", domain);
            releaseQuietly(domain);
            throw e;
        }
    }

    /**
     * Publishes the version at {@code versionIndex} to the project's domain.
     *
     * @throws NotFoundException         when the project does not exist
     * @throws ValidationException       for an out-of-range index or a project without domain
     * @throws DeploymentFailedException when the object store rejects the write; the pointer is unchanged
     */
    public PublishResult publish(String projectId, int versionIndex) {
        try (var mdc = MdcContext.open(projectId, "publish")) {
            long start = System.currentTimeMillis();
            Project project = store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
            if (!project.hasVersionIndex(versionIndex)) {
                throw new ValidationException("Invalid versionIndex %d (project has %d versions)"
                        .formatted(versionIndex, project.versions().size()));
            }
            String domain = project.domain();
            if (domain == null || domain.isBlank()) {
                throw new ValidationException("Project does not have a domain");
            }
            HtmlVersion version = project.versions().get(versionIndex);

            String key = keys.html(domain);
            try {
                objectStore.put(key, version.content().getBytes(StandardCharsets.UTF_8), HTML_CONTENT_TYPE);
            } catch (UpstreamUnavailableException e) {
                metrics.recordPublish(false, System.currentTimeMillis() - start);
                log.error("Publish of version {} to {} failed: {}", versionIndex, domain, e.getMessage());
                throw new DeploymentFailedException("Failed to deploy HTML to domain " + domain, e);
            }

            boolean committed = store.withLock(projectId, () -> {
                if (store.get(projectId).isEmpty()) {
                    return false;
                }
                store.update(projectId, ProjectUpdate.deployedIndex(versionIndex));
                return true;
            });
            if (!committed) {
                log.warn("Project {} was deleted while version {} was being written; removing {}",
                        projectId, versionIndex, key);
                discardOrphan(key);
                throw NotFoundException.project(projectId);
            }

            metrics.recordPublish(true, System.currentTimeMillis() - start);
            log.info("Published version {} of project {} to https://{}", versionIndex, projectId, domain);
            return new PublishResult(true, "Deployed version " + versionIndex, "https://" + domain, domain, versionIndex);
        }
    }

    /**
     * Deletes the project's published objects, releases its domain and removes
     * the record. External cleanup failures are logged and reported but never
     * stop the record from being removed.
     *
     * @throws NotFoundException when the project does not exist
     */
    public TeardownResult deleteProject(String projectId) {
        try (var mdc = MdcContext.open(projectId, "teardown")) {
            return store.withLock(projectId, () -> {
                Project project = store.get(projectId).orElseThrow(() -> NotFoundException.project(projectId));
                List<String> failures = new ArrayList<>();
                String domain = project.domain();

                if (domain != null && !domain.isBlank()) {
                    cleanup("html", "HTML cleanup failed", failures, () -> objectStore.delete(keys.html(domain)));
                    for (Asset asset : project.assets()) {
                        cleanup("asset", "asset cleanup failed for " + asset.filename(), failures,
                                () -> objectStore.delete(keys.asset(domain, asset.filename())));
                    }
                    cleanup("domain", "domain release failed for " + domain, failures,
                            () -> domainRegistry.unregister(domain));
                }

                store.delete(projectId);
                metrics.recordTeardown(failures.isEmpty());

                String message = failures.isEmpty()
                        ? "Project deleted"
                        : "Project deleted; " + String.join("; ", failures);
                if (failures.isEmpty()) {
                    log.info("Project {} deleted", projectId);
                } else {
                    log.warn("Project {} deleted with {} cleanup failure(s)", projectId, failures.size());
                }
                return new TeardownResult(true, message, failures);
            });
        }
    }

    private void cleanup(String step, String description, List<String> failures, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Teardown step '{}' failed: {}", step, e.getMessage());
            metrics.recordCleanupFailure(step);
            failures.add(description);
        }
    }

    private void discardOrphan(String key) {
        try {
            objectStore.delete(key);
        } catch (UpstreamUnavailableException e) {
            log.warn("Could not remove orphaned object {}: {}", key, e.getMessage());
        }
    }

    private void releaseQuietly(String domain) {
        try {
            domainRegistry.unregister(domain);
        } catch (RuntimeException e) {
            log.warn("Could not release domain {} after failed creation: {}", domain, e.getMessage());
        }
    }
}
