package com.sitesmith.storage;

import java.util.List;
import java.util.Optional;

/**
 * Keyed blob storage behind the published websites.
 *
 * <p>All methods report collaborator failures, including timeouts, as
 * {@link com.sitesmith.core.error.UpstreamUnavailableException}.
 */
public interface ObjectStore {

    /** Writes or overwrites the object at {@code key}. */
    void put(String key, byte[] content, String contentType);

    Optional<byte[]> get(String key);

    /** Removes the object; deleting a missing key is not an error. */
    void delete(String key);

    /** Keys starting with {@code prefix}, in lexical order. */
    List<String> list(String prefix);

    /** Short provider description for health output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
