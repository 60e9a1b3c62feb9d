package com.sitesmith.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitesmith.core.error.PersistenceFailedException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.metrics.SitesmithMetrics;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.model.ProjectPage;
import com.sitesmith.core.model.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link ProjectStore} holding every project in memory and rewriting one JSON
 * file on each mutation.
 *
 * <p>A mutation builds the next map, writes it to a temporary file, moves it
 * over the store file and only then swaps it in. A failed write therefore
 * leaves both the file and the in-memory view at their previous state. The
 * cost is proportional to the total data size on every write, which is
 * acceptable at the expected volume.
 */
public class JsonFileProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileProjectStore.class);
    private static final TypeReference<LinkedHashMap<String, Project>> STORE_TYPE = new TypeReference<>() {};
    static final int LOCK_STRIPES = 64;

    private final Path filePath;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final SitesmithMetrics metrics;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final ReentrantLock[] projectLocks = new ReentrantLock[LOCK_STRIPES];

    private Map<String, Project> projects = new LinkedHashMap<>();

    public JsonFileProjectStore(Path filePath, ObjectMapper mapper, Clock clock, SitesmithMetrics metrics) {
        this.filePath = filePath.toAbsolutePath();
        this.mapper = mapper;
        this.clock = clock;
        this.metrics = metrics;
        for (int i = 0; i < projectLocks.length; i++) {
            projectLocks[i] = new ReentrantLock();
        }
        load();
    }

    /**
     * Mapper used for the store file: ISO-8601 timestamps, indented output,
     * unknown fields ignored so older and newer records both load.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public Path filePath() {
        return filePath;
    }

    @Override
    public Project create(String domain) {
        lock.writeLock().lock();
        try {
            var project = Project.create(UUID.randomUUID().toString(), Instant.now(clock), domain);
            var next = new LinkedHashMap<>(projects);
            next.put(project.id(), project);
            commit(next);
            log.info("Created project {} for domain {}", project.id(), domain);
            return project;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Project> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(projects.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Project> update(String id, ProjectUpdate update) {
        lock.writeLock().lock();
        try {
            Project existing = projects.get(id);
            if (existing == null) {
                return Optional.empty();
            }
            Project merged = update.applyTo(existing);
            Integer deployed = merged.deployedIndex();
            if (deployed != null && !merged.hasVersionIndex(deployed)) {
                throw new ValidationException("Deployed index %d is outside %d versions"
                        .formatted(deployed, merged.versions().size()));
            }
            var next = new LinkedHashMap<>(projects);
            next.put(id, merged);
            commit(next);
            return Optional.of(merged);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            if (!projects.containsKey(id)) {
                return false;
            }
            var next = new LinkedHashMap<>(projects);
            next.remove(id);
            commit(next);
            log.info("Deleted project record {}", id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ProjectPage list(int page, int pageSize, SortOrder order) {
        int safePage = Math.max(1, page);
        int safeSize = Math.max(1, pageSize);

        List<Project> snapshot;
        lock.readLock().lock();
        try {
            snapshot = List.copyOf(projects.values());
        } finally {
            lock.readLock().unlock();
        }

        Comparator<Project> byCreation = Comparator.comparing(Project::createdAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        if (order == SortOrder.DESC) {
            byCreation = byCreation.reversed();
        }
        var sorted = snapshot.stream().sorted(byCreation).toList();

        int total = sorted.size();
        int from = (int) Math.min((long) (safePage - 1) * safeSize, total);
        int to = Math.min(from + safeSize, total);
        int totalPages = (total + safeSize - 1) / safeSize;
        return new ProjectPage(sorted.subList(from, to), safePage, safeSize, total, totalPages);
    }

    /**
     * Serializes work per project id. Ids share a fixed set of lock stripes, so
     * unknown or deleted ids leave nothing behind; two ids on the same stripe
     * merely wait for each other.
     */
    @Override
    public <T> T withLock(String id, Supplier<T> work) {
        ReentrantLock projectLock = lockFor(id);
        projectLock.lock();
        try {
            return work.get();
        } finally {
            projectLock.unlock();
        }
    }

    ReentrantLock lockFor(String id) {
        return projectLocks[Math.floorMod(id.hashCode(), projectLocks.length)];
    }

    private void commit(Map<String, Project> next) {
        flush(next);
        projects = next;
    }

    private void flush(Map<String, Project> snapshot) {
        long start = System.currentTimeMillis();
        Path tmp = null;
        try {
            Files.createDirectories(filePath.getParent());
            tmp = Files.createTempFile(filePath.getParent(), filePath.getFileName().toString(), ".tmp");
            Files.write(tmp, mapper.writeValueAsBytes(snapshot));
            try {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            log.error("Failed to persist project store to {}: {}", filePath, e.getMessage());
            throw new PersistenceFailedException("Failed to persist project store to " + filePath, e);
        }
        metrics.recordStoreFlush(System.currentTimeMillis() - start);
    }

    private void load() {
        lock.writeLock().lock();
        try {
            if (!Files.exists(filePath)) {
                commit(new LinkedHashMap<>());
                return;
            }
            byte[] raw = Files.readAllBytes(filePath);
            if (raw.length == 0) {
                projects = new LinkedHashMap<>();
                return;
            }
            projects = mapper.readValue(raw, STORE_TYPE);
            log.info("Loaded {} project(s) from {}", projects.size(), filePath);
        } catch (IOException e) {
            Path aside = filePath.resolveSibling(filePath.getFileName() + ".corrupt-" + clock.millis());
            log.error("Project store {} is unreadable ({}); moving it to {} and starting empty",
                    filePath, e.getMessage(), aside);
            try {
                Files.move(filePath, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new PersistenceFailedException("Cannot move unreadable store " + filePath + " aside", moveError);
            }
            commit(new LinkedHashMap<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
