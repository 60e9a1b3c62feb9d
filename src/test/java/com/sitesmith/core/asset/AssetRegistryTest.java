package com.sitesmith.core.asset;

import com.sitesmith.core.MutableClock;
import com.sitesmith.core.error.NotFoundException;
import com.sitesmith.core.error.UnsupportedMediaTypeException;
import com.sitesmith.core.error.UpstreamUnavailableException;
import com.sitesmith.core.error.ValidationException;
import com.sitesmith.core.metrics.SitesmithMetrics;
import com.sitesmith.core.model.Asset;
import com.sitesmith.core.store.JsonFileProjectStore;
import com.sitesmith.core.upstream.UpstreamCalls;
import com.sitesmith.storage.InMemoryObjectStore;
import com.sitesmith.storage.StorageKeys;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AssetRegistryTest {

    private static final String DOMAIN = "test-calm-lake-1234.example";

    @TempDir
    Path dir;

    private SimpleMeterRegistry meters;
    private JsonFileProjectStore store;
    private InMemoryObjectStore objects;
    private CaptionService captions;
    private UpstreamCalls upstreamCalls;
    private AssetProperties properties;
    private AssetRegistry registry;
    private String projectId;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        meters = new SimpleMeterRegistry();
        var metrics = new SitesmithMetrics(meters);
        store = new JsonFileProjectStore(dir.resolve("projects.json"), JsonFileProjectStore.defaultMapper(),
                clock, metrics);
        objects = new InMemoryObjectStore();
        captions = mock(CaptionService.class);
        upstreamCalls = new UpstreamCalls();
        properties = new AssetProperties();
        registry = new AssetRegistry(store, objects, new StorageKeys("website"), new ImageInspector(),
                new ImageNormalizer(), captions, upstreamCalls, properties, metrics, clock);
        projectId = store.create(DOMAIN).id();
    }

    @AfterEach
    void tearDown() {
        upstreamCalls.destroy();
    }

    @Test
    @DisplayName("ingest stores the PNG object and records the asset with caption and geometry")
    void ingestsImage() {
        when(captions.caption(any(), eq("image/jpeg"))).thenReturn("Caption: a blue square");

        var asset = registry.ingest(projectId, TestImages.jpeg(1600, 900), "Hero Shot.jpg", "image/jpeg");

        assertEquals("Hero_Shot.png", asset.filename());
        assertEquals("image/png", asset.contentType());
        assertEquals("https://" + DOMAIN + "/assets/Hero_Shot.png", asset.url());
        assertEquals("Caption: a blue square\nAspect Ratio: 16:9 (landscape)", asset.description());

        String key = "website/" + DOMAIN + "/assets/Hero_Shot.png";
        byte[] stored = objects.get(key).orElseThrow();
        assertEquals("image/png", objects.contentType(key).orElseThrow());
        assertEquals(asset.description(), ImageNormalizer.embeddedDescription(stored).orElseThrow());
        assertEquals(1, store.get(projectId).orElseThrow().assets().size());
        assertEquals(1.0, meters.get("sitesmith.assets.ingested").tag("content_type", "image/jpeg").counter().count());
    }

    @Test
    @DisplayName("unsupported content type is rejected before anything else happens")
    void unsupportedType() {
        assertThrows(UnsupportedMediaTypeException.class,
                () -> registry.ingest(projectId, new byte[]{1, 2, 3}, "doc.pdf", "application/pdf"));
        verifyNoInteractions(captions);
        assertTrue(objects.list("website/").isEmpty());
    }

    @Test
    @DisplayName("undecodable bytes are a validation error")
    void corruptImage() {
        assertThrows(ValidationException.class,
                () -> registry.ingest(projectId, new byte[]{1, 2, 3, 4}, "broken.png", "image/png"));
        assertTrue(store.get(projectId).orElseThrow().assets().isEmpty());
    }

    @Test
    @DisplayName("caption failure falls back to the placeholder")
    void captionFailure() {
        when(captions.caption(any(), anyString())).thenThrow(new IllegalStateException("model offline"));

        var asset = registry.ingest(projectId, TestImages.png(500, 500), "logo.png", "image/png");

        assertEquals("No caption available\nAspect Ratio: 1:1 (square)", asset.description());
        assertEquals(1.0, meters.get("sitesmith.assets.caption_fallbacks").counter().count());
    }

    @Test
    @DisplayName("caption timeout falls back to the placeholder")
    void captionTimeout() {
        properties.setCaptionTimeoutSeconds(1);
        when(captions.caption(any(), anyString())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return "too late";
        });

        var asset = registry.ingest(projectId, TestImages.png(300, 400), "tall.png", "image/png");

        assertTrue(asset.description().startsWith("No caption available"));
        assertTrue(asset.description().endsWith("Aspect Ratio: 3:4 (portrait)"));
    }

    @Test
    @DisplayName("upload failure leaves no asset record")
    void uploadFailure() {
        var failing = new InMemoryObjectStore() {
            @Override
            public void put(String key, byte[] content, String contentType) {
                throw new UpstreamUnavailableException("object-store", "bucket unreachable");
            }
        };
        var broken = new AssetRegistry(store, failing, new StorageKeys("website"), new ImageInspector(),
                new ImageNormalizer(), captions, upstreamCalls, properties,
                new SitesmithMetrics(meters), new MutableClock(Instant.now()));
        when(captions.caption(any(), anyString())).thenReturn("Caption: x");

        assertThrows(UpstreamUnavailableException.class,
                () -> broken.ingest(projectId, TestImages.png(20, 20), "x.png", "image/png"));
        assertTrue(store.get(projectId).orElseThrow().assets().isEmpty());
    }

    @Test
    @DisplayName("same filename twice keeps both objects addressable")
    void duplicateFilename() {
        when(captions.caption(any(), anyString())).thenReturn("Caption: logo");

        var first = registry.ingest(projectId, TestImages.png(20, 20), "logo.png", "image/png");
        var second = registry.ingest(projectId, TestImages.png(40, 20), "logo.png", "image/png");

        assertEquals("logo.png", first.filename());
        assertNotEquals(first.filename(), second.filename());
        assertTrue(second.filename().matches("logo-[0-9a-f]{8}\\.png"), second.filename());
        assertEquals(2, objects.list("website/" + DOMAIN + "/assets/").size());
    }

    @Test
    @DisplayName("concurrent uploads with one filename get distinct objects")
    void concurrentDuplicateFilename() throws Exception {
        when(captions.caption(any(), anyString())).thenReturn("Caption: logo");
        var bothWriting = new CyclicBarrier(2);
        var gated = new InMemoryObjectStore() {
            @Override
            public void put(String key, byte[] content, String contentType) {
                try {
                    bothWriting.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("uploads did not overlap", e);
                }
                super.put(key, content, contentType);
            }
        };
        var concurrent = new AssetRegistry(store, gated, new StorageKeys("website"), new ImageInspector(),
                new ImageNormalizer(), captions, upstreamCalls, properties,
                new SitesmithMetrics(meters), new MutableClock(Instant.now()));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Asset> a = pool.submit(() -> concurrent.ingest(projectId, TestImages.png(20, 20), "logo.png", "image/png"));
            Future<Asset> b = pool.submit(() -> concurrent.ingest(projectId, TestImages.png(40, 20), "logo.png", "image/png"));
            Asset first = a.get(10, TimeUnit.SECONDS);
            Asset second = b.get(10, TimeUnit.SECONDS);

            assertNotEquals(first.filename(), second.filename());
            assertEquals(2, gated.list("website/" + DOMAIN + "/assets/").size());

            concurrent.remove(projectId, first.id());
            assertTrue(gated.get("website/" + DOMAIN + "/assets/" + second.filename()).isPresent());
            assertEquals(1, concurrent.listAssets(projectId).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("remove deletes the object and then the record")
    void remove() {
        when(captions.caption(any(), anyString())).thenReturn("Caption: logo");
        var asset = registry.ingest(projectId, TestImages.png(20, 20), "logo.png", "image/png");

        registry.remove(projectId, asset.id());

        assertTrue(objects.list("website/").isEmpty());
        assertTrue(registry.listAssets(projectId).isEmpty());
        assertThrows(NotFoundException.class, () -> registry.remove(projectId, asset.id()));
    }

    @Test
    @DisplayName("failed object delete keeps the record for a retry")
    void removeFailureKeepsRecord() {
        when(captions.caption(any(), anyString())).thenReturn("Caption: logo");
        var asset = registry.ingest(projectId, TestImages.png(20, 20), "logo.png", "image/png");
        var failing = new InMemoryObjectStore() {
            @Override
            public void delete(String key) {
                throw new UpstreamUnavailableException("object-store", "down");
            }
        };
        var broken = new AssetRegistry(store, failing, new StorageKeys("website"), new ImageInspector(),
                new ImageNormalizer(), captions, upstreamCalls, properties,
                new SitesmithMetrics(meters), new MutableClock(Instant.now()));

        assertThrows(UpstreamUnavailableException.class, () -> broken.remove(projectId, asset.id()));
        assertEquals(1, registry.listAssets(projectId).size());
    }

    @Test
    @DisplayName("client paths are stripped from filenames")
    void sanitize() {
        assertEquals("photo.jpg", AssetRegistry.sanitize("C:\\Users\\me\\photo.jpg", SupportedImageType.JPEG));
        assertEquals("my_pic.png", AssetRegistry.sanitize("../../my pic.png", SupportedImageType.PNG));
        assertTrue(AssetRegistry.sanitize(null, SupportedImageType.GIF).matches("image-[0-9a-f]{8}\\.gif"));
    }

    @Test
    @DisplayName("unknown project is NotFound")
    void unknownProject() {
        assertThrows(NotFoundException.class,
                () -> registry.ingest("missing", TestImages.png(5, 5), "a.png", "image/png"));
    }
}
