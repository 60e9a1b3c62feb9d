package com.sitesmith.core.store;

import com.sitesmith.core.model.Project;
import com.sitesmith.core.model.ProjectPage;
import com.sitesmith.core.model.SortOrder;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable keyed collection of {@link Project} records and the single point of
 * truth for reads.
 *
 * <p>Every mutating call is durable when it returns: implementations must not
 * acknowledge a write before it has reached storage. Read-modify-write
 * sequences on one project are serialized by wrapping them in
 * {@link #withLock(String, Supplier)}.
 */
public interface ProjectStore {

    /**
     * Allocates an id and timestamp and stores an empty project for the domain.
     *
     * @throws com.sitesmith.core.error.PersistenceFailedException if the write did not reach storage
     */
    Project create(String domain);

    Optional<Project> get(String id);

    /**
     * Merges the non-null fields of {@code update} into the stored record.
     *
     * @return the merged record, or empty when no project has this id
     * @throws com.sitesmith.core.error.PersistenceFailedException if the write did not reach storage
     */
    Optional<Project> update(String id, ProjectUpdate update);

    /**
     * @return whether a record existed and was removed
     */
    boolean delete(String id);

    /**
     * Offset pagination over all projects sorted by creation time.
     *
     * @param page     1-based page number
     * @param pageSize items per page
     */
    ProjectPage list(int page, int pageSize, SortOrder order);

    /**
     * Runs {@code work} while holding the lock for one project id. Work on
     * different ids runs concurrently.
     */
    <T> T withLock(String id, Supplier<T> work);
}
