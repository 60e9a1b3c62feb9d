package com.sitesmith.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitesmith.core.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the domain API that binds hostnames to the website bucket.
 *
 * <p>Both operations POST {@code {"domain": "<hostname>"}} with the API key in
 * the {@code X-API-Key} header. Any non-2xx answer is a failure.
 */
public class HttpDomainRegistry implements DomainRegistry {

    private static final Logger log = LoggerFactory.getLogger(HttpDomainRegistry.class);
    private static final String COLLABORATOR = "domain-registry";

    private final DomainRegistryProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final String baseUrl;

    public HttpDomainRegistry(DomainRegistryProperties properties) {
        this.properties = properties;
        this.baseUrl = validBaseUrl(properties.getApiUrl());
        if (baseUrl == null) {
            log.error("sitesmith.domain.api-url '{}' is not an absolute http(s) URL; domain calls will fail",
                    properties.getApiUrl());
        }
        this.requestTimeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void register(String hostname) {
        post("/add-domain", hostname);
        log.info("Registered domain {}", hostname);
    }

    @Override
    public void unregister(String hostname) {
        post("/remove-domain", hostname);
        log.info("Unregistered domain {}", hostname);
    }

    @Override
    public String describe() {
        return "http " + properties.getApiUrl();
    }

    void post(String path, String hostname) {
        if (baseUrl == null) {
            throw new UpstreamUnavailableException(COLLABORATOR,
                    "Domain API URL is not configured: POST " + path + " for " + hostname);
        }
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("domain", hostname);
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode domain payload", e);
        }

        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("X-API-Key", properties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new UpstreamUnavailableException(COLLABORATOR,
                        "Domain API POST %s for %s failed (HTTP %d): %s"
                                .formatted(path, hostname, response.statusCode(), response.body()));
            }
        } catch (IOException e) {
            throw new UpstreamUnavailableException(COLLABORATOR,
                    "Domain API request failed: POST " + path + " for " + hostname, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(COLLABORATOR,
                    "Domain API request interrupted: POST " + path, e);
        }
    }

    /** The configured URL without its trailing slash, or null when it cannot address the API. */
    static String validBaseUrl(String apiUrl) {
        if (apiUrl == null || apiUrl.isBlank()) {
            return null;
        }
        String trimmed = apiUrl.trim();
        String url = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                return null;
            }
            return url;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
