package com.sitesmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for project storage, publishing and teardown.
 */
@Service
public class SitesmithMetrics {

    private final MeterRegistry registry;

    public SitesmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProjectCreated() {
        Counter.builder("sitesmith.projects.created")
                .register(registry)
                .increment();
    }

    public void recordPublish(boolean success, long ms) {
        Timer.builder("sitesmith.publish.duration")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a completed project teardown.
     *
     * @param clean true when every external cleanup step succeeded
     */
    public void recordTeardown(boolean clean) {
        Counter.builder("sitesmith.teardown.total")
                .tag("result", clean ? "clean" : "partial")
                .register(registry)
                .increment();
    }

    /**
     * Records one absorbed cleanup failure during teardown.
     *
     * @param step "html", "asset" or "domain"
     */
    public void recordCleanupFailure(String step) {
        Counter.builder("sitesmith.teardown.cleanup_failures")
                .description("External cleanup steps that failed and were skipped")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordAssetIngested(String contentType) {
        Counter.builder("sitesmith.assets.ingested")
                .tag("content_type", contentType)
                .register(registry)
                .increment();
    }

    public void recordCaptionFallback() {
        Counter.builder("sitesmith.assets.caption_fallbacks")
                .description("Uploads stored with the placeholder caption")
                .register(registry)
                .increment();
    }

    public void recordStoreFlush(long ms) {
        Timer.builder("sitesmith.store.flush.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
