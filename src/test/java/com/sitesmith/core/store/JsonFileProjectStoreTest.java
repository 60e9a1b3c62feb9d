package com.sitesmith.core.store;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sitesmith.core.MutableClock;
import com.sitesmith.core.error.PersistenceFailedException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.metrics.SitesmithMetrics;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;
import com.sitesmith.core.model.SortOrder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileProjectStoreTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private Path file;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        file = dir.resolve("data").resolve("projects.json");
    }

    private JsonFileProjectStore open() {
        return new JsonFileProjectStore(file, JsonFileProjectStore.defaultMapper(), clock,
                new SitesmithMetrics(registry));
    }

    @Test
    @DisplayName("missing file is created empty on startup")
    void missingFileCreatedEmpty() throws Exception {
        var store = open();
        assertTrue(Files.exists(file));
        assertEquals(0, store.list(1, 10, SortOrder.DESC).totalCount());
        assertEquals("{ }", Files.readString(file).trim());
    }

    @Test
    @DisplayName("create is durable before returning and survives a restart")
    void createIsDurable() {
        var project = open().create("test-calm-lake-1234.example");

        var reopened = open().get(project.id()).orElseThrow();
        assertEquals(project.domain(), reopened.domain());
        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), reopened.createdAt());
        assertTrue(reopened.versions().isEmpty());
        assertNull(reopened.deployedIndex());
        assertNotNull(registry.find("sitesmith.store.flush.duration").timer());
    }

    @Test
    @DisplayName("update merges only the fields it sets")
    void updateMergesFields() {
        var store = open();
        var project = store.create("d.example");
        var version = new HtmlVersion("v1", "<html>A</html>", clock.instant());
        store.update(project.id(), ProjectUpdate.versions(List.of(version)));

        var conversation = JsonNodeFactory.instance.arrayNode().add("hello");
        var updated = store.update(project.id(), ProjectUpdate.conversation(conversation)).orElseThrow();

        assertEquals(List.of(version), updated.versions());
        assertEquals(conversation, updated.conversation());
        assertEquals("d.example", updated.domain());
    }

    @Test
    @DisplayName("update of unknown id is empty and delete of unknown id is false")
    void unknownIds() {
        var store = open();
        assertTrue(store.update("nope", ProjectUpdate.deployedIndex(0)).isEmpty());
        assertFalse(store.delete("nope"));
    }

    @Test
    @DisplayName("deployed index must point at an existing version")
    void deployedIndexValidated() {
        var store = open();
        var project = store.create("d.example");

        assertThrows(ValidationException.class,
                () -> store.update(project.id(), ProjectUpdate.deployedIndex(0)));
        assertNull(store.get(project.id()).orElseThrow().deployedIndex());
    }

    @Test
    @DisplayName("delete removes the record from memory and disk")
    void deleteRemoves() {
        var store = open();
        var project = store.create("d.example");
        assertTrue(store.delete(project.id()));
        assertTrue(store.get(project.id()).isEmpty());
        assertTrue(open().get(project.id()).isEmpty());
    }

    @Test
    @DisplayName("list paginates over projects sorted by creation time")
    void listPaginates() {
        var store = open();
        var first = store.create("one.example");
        clock.advance(Duration.ofMinutes(1));
        var second = store.create("two.example");
        clock.advance(Duration.ofMinutes(1));
        var third = store.create("three.example");

        var desc = store.list(1, 2, SortOrder.DESC);
        assertEquals(List.of(third.id(), second.id()), desc.items().stream().map(Project::id).toList());
        assertEquals(3, desc.totalCount());
        assertEquals(2, desc.totalPages());

        var asc = store.list(2, 2, SortOrder.ASC);
        assertEquals(List.of(third.id()), asc.items().stream().map(Project::id).toList());
        assertEquals(first.id(), store.list(1, 1, SortOrder.ASC).items().get(0).id());

        assertTrue(store.list(5, 2, SortOrder.ASC).items().isEmpty());
        assertEquals(1, store.list(0, 0, SortOrder.ASC).page());
    }

    @Test
    @DisplayName("unreadable file is moved aside and the store starts empty")
    void corruptFileMovedAside() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ this is not json", StandardCharsets.UTF_8);

        var store = open();

        assertEquals(0, store.list(1, 10, SortOrder.DESC).totalCount());
        Path aside = file.resolveSibling("projects.json.corrupt-" + clock.millis());
        assertTrue(Files.exists(aside));
        assertEquals("{ this is not json", Files.readString(aside));
    }

    @Test
    @DisplayName("records written with the legacy field names still load")
    void legacyFieldNames() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, """
                {
                  "p1": {
                    "id": "p1",
                    "createdAt": "2024-05-01T12:00:00Z",
                    "domain": "test-epic-quest-5555.example",
                    "htmlVersions": [
                      {"id": "v1", "htmlContent": "<html>old</html>", "createdAt": "2024-05-01T12:01:00Z"}
                    ],
                    "currentHtmlIndex": 0,
                    "assets": [
                      {"id": "a1", "url": "https://x/assets/a.webp", "filename": "a.webp",
                       "uploadedAt": "2024-05-01T12:02:00Z", "type": "image/webp", "description": "cat"}
                    ],
                    "messages": [{"role": "user", "content": "make a site"}],
                    "someFutureField": true
                  }
                }
                """);

        var project = open().get("p1").orElseThrow();

        assertEquals("<html>old</html>", project.versions().get(0).content());
        assertEquals(0, project.deployedIndex());
        assertEquals("image/webp", project.assets().get(0).contentType());
        assertEquals("make a site", project.conversation().get(0).get("content").asText());
    }

    @Test
    @DisplayName("failed flush surfaces PersistenceFailed and keeps the previous state")
    void failedFlushKeepsState() throws Exception {
        var store = open();
        var project = store.create("d.example");

        // replace the data directory with a plain file so the next write cannot land
        Files.delete(file);
        Files.delete(file.getParent());
        Files.writeString(file.getParent(), "blocker");

        assertThrows(PersistenceFailedException.class, () -> store.create("other.example"));
        assertThrows(PersistenceFailedException.class, () -> store.delete(project.id()));
        assertEquals(1, store.list(1, 10, SortOrder.DESC).totalCount());
        assertTrue(store.get(project.id()).isPresent());
    }

    @Test
    @DisplayName("withLock serializes one id but lets other ids proceed")
    void withLockIsPerId() throws Exception {
        var store = open();
        var holding = new CountDownLatch(1);
        var release = new CountDownLatch(1);

        var holder = new Thread(() -> store.withLock("a", () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        holder.start();
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        var otherIdRan = new AtomicBoolean();
        var other = new Thread(() -> store.withLock("b", () -> {
            otherIdRan.set(true);
            return null;
        }));
        other.start();
        other.join(5000);
        assertTrue(otherIdRan.get());

        var sameIdRan = new AtomicBoolean();
        var same = new Thread(() -> store.withLock("a", () -> {
            sameIdRan.set(true);
            return null;
        }));
        same.start();
        same.join(200);
        assertFalse(sameIdRan.get());

        release.countDown();
        same.join(5000);
        holder.join(5000);
        assertTrue(sameIdRan.get());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("locking unknown ids does not grow lock state")
    void lockStateIsBounded() {
        var store = open();
        Set<ReentrantLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            String id = "missing-" + i;
            assertTrue(store.withLock(id, () -> store.get(id)).isEmpty());
            seen.add(store.lockFor(id));
        }

        assertTrue(seen.size() <= JsonFileProjectStore.LOCK_STRIPES, "distinct locks: " + seen.size());
        assertSame(store.lockFor("missing-42"), store.lockFor("missing-42"));
        assertFalse(store.lockFor("missing-42").isLocked());
    }
}
