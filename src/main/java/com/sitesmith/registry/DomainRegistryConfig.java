package com.sitesmith.registry;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DomainRegistryConfig {

    @Bean
    @ConditionalOnProperty(name = "sitesmith.domain.provider", havingValue = "memory", matchIfMissing = true)
    public DomainRegistry inMemoryDomainRegistry() {
        return new InMemoryDomainRegistry();
    }

    @Bean
    @ConditionalOnProperty(name = "sitesmith.domain.provider", havingValue = "http")
    public DomainRegistry httpDomainRegistry(DomainRegistryProperties properties) {
        return new HttpDomainRegistry(properties);
    }
}
