package com.sitesmith.storage;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

@Configuration
public class ObjectStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "sitesmith.object-store.provider", havingValue = "memory", matchIfMissing = true)
    public ObjectStore inMemoryObjectStore() {
        return new InMemoryObjectStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "sitesmith.object-store.provider", havingValue = "s3")
    public S3Client s3Client(ObjectStoreProperties properties) {
        var builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                        .build());
        if (properties.hasEndpoint()) {
            // R2 and MinIO need an explicit endpoint
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        }
        if (!properties.getAccessKeyId().isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "sitesmith.object-store.provider", havingValue = "s3")
    public ObjectStore s3ObjectStore(S3Client s3Client, ObjectStoreProperties properties) {
        return new S3ObjectStore(s3Client, properties.getBucket());
    }
}
