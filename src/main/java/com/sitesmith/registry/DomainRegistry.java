package com.sitesmith.registry;

/**
 * External service that makes a hostname resolve to the published website.
 *
 * <p>Failures, including timeouts, surface as
 * {@link com.sitesmith.core.error.UpstreamUnavailableException}.
 */
public interface DomainRegistry {

    void register(String hostname);

    void unregister(String hostname);

    default String describe() {
        return getClass().getSimpleName();
    }
}
