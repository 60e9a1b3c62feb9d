package com.sitesmith.core.store;

import com.sitesmith.core.metrics.SitesmithMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class ProjectStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProjectStore projectStore(StoreProperties properties, Clock clock, SitesmithMetrics metrics) {
        return new JsonFileProjectStore(Path.of(properties.getPath()),
                JsonFileProjectStore.defaultMapper(), clock, metrics);
    }
}
