package com.sitesmith.core.generation;

import com.sitesmith.core.model.Asset;

/** What a generator needs to know to place an uploaded image in a page. */
public record AssetRef(String id, String url, String contentType, String description) {

    public static AssetRef from(Asset asset) {
        return new AssetRef(asset.id(), asset.url(), asset.contentType(), asset.description());
    }
}
