package com.sitesmith.storage;

import org.springframework.stereotype.Component;

/**
 * Builds object keys for a project's published files. Every key lives under
 * {@code {keyPrefix}/{domain}/}.
 */
@Component
public class StorageKeys {

    private final String keyPrefix;

    public StorageKeys(ObjectStoreProperties properties) {
        this(properties.getKeyPrefix());
    }

    public StorageKeys(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String site(String domain) {
        return keyPrefix + "/" + domain + "/";
    }

    public String html(String domain) {
        return site(domain) + "index.html";
    }

    public String asset(String domain, String filename) {
        return site(domain) + "assets/" + filename;
    }
}
