package com.sitesmith.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SitesmithMetricsTest {

    private SimpleMeterRegistry registry;
    private SitesmithMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SitesmithMetrics(registry);
    }

    @Test
    @DisplayName("recordProjectCreated increments the counter")
    void projectCreated() {
        metrics.recordProjectCreated();
        metrics.recordProjectCreated();
        assertEquals(2.0, registry.get("sitesmith.projects.created").counter().count());
    }

    @Test
    @DisplayName("recordPublish tags the timer with the result")
    void publish() {
        metrics.recordPublish(true, 120);
        metrics.recordPublish(false, 30);
        var success = registry.get("sitesmith.publish.duration").tag("result", "success").timer();
        var failure = registry.get("sitesmith.publish.duration").tag("result", "failure").timer();
        assertEquals(1, success.count());
        assertEquals(120.0, success.totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1, failure.count());
    }

    @Test
    @DisplayName("teardown and cleanup failures are counted separately")
    void teardown() {
        metrics.recordTeardown(true);
        metrics.recordTeardown(false);
        metrics.recordCleanupFailure("asset");
        metrics.recordCleanupFailure("asset");
        metrics.recordCleanupFailure("domain");

        assertEquals(1.0, registry.get("sitesmith.teardown.total").tag("result", "clean").counter().count());
        assertEquals(1.0, registry.get("sitesmith.teardown.total").tag("result", "partial").counter().count());
        assertEquals(2.0, registry.get("sitesmith.teardown.cleanup_failures").tag("step", "asset").counter().count());
        assertEquals(1.0, registry.get("sitesmith.teardown.cleanup_failures").tag("step", "domain").counter().count());
    }

    @Test
    @DisplayName("asset metrics are tagged by content type")
    void assets() {
        metrics.recordAssetIngested("image/webp");
        metrics.recordCaptionFallback();
        assertEquals(1.0, registry.get("sitesmith.assets.ingested").tag("content_type", "image/webp").counter().count());
        assertEquals(1.0, registry.get("sitesmith.assets.caption_fallbacks").counter().count());
    }

    @Test
    @DisplayName("recordStoreFlush records a timer sample")
    void storeFlush() {
        metrics.recordStoreFlush(7);
        assertEquals(1, registry.get("sitesmith.store.flush.duration").timer().count());
    }
}
