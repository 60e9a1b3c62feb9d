package com.sitesmith.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One generated website: its version history, uploaded assets, public domain
 * and the pointer to the version currently published there.
 *
 * <p>Records persisted by earlier releases used {@code htmlVersions},
 * {@code currentHtmlIndex} and {@code messages}; those names are still read.
 *
 * @param id            opaque unique identifier, immutable
 * @param createdAt     creation timestamp, set once
 * @param domain        public hostname allocated at creation
 * @param versions      HTML snapshots in creation order
 * @param deployedIndex index into {@code versions} of the published snapshot; null when nothing is published
 * @param assets        uploaded assets in upload order
 * @param conversation  chat transcript owned by the chat front end; stored as-is
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Project(
    String id,
    Instant createdAt,
    String domain,
    @JsonAlias("htmlVersions") List<HtmlVersion> versions,
    @JsonAlias("currentHtmlIndex") Integer deployedIndex,
    List<Asset> assets,
    @JsonAlias("messages") JsonNode conversation
) {

    public Project {
        versions = versions == null ? List.of() : List.copyOf(versions);
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    public static Project create(String id, Instant createdAt, String domain) {
        return new Project(id, createdAt, domain, List.of(), null, List.of(), null);
    }

    public boolean hasVersionIndex(int index) {
        return index >= 0 && index < versions.size();
    }

    public Optional<HtmlVersion> versionAt(int index) {
        return hasVersionIndex(index) ? Optional.of(versions.get(index)) : Optional.empty();
    }

    public Optional<HtmlVersion> findVersion(String versionId) {
        return versions.stream().filter(v -> v.id().equals(versionId)).findFirst();
    }

    public Optional<Asset> findAsset(String assetId) {
        return assets.stream().filter(a -> a.id().equals(assetId)).findFirst();
    }

    public Project withVersions(List<HtmlVersion> versions) {
        return new Project(id, createdAt, domain, versions, deployedIndex, assets, conversation);
    }

    public Project withDeployedIndex(Integer deployedIndex) {
        return new Project(id, createdAt, domain, versions, deployedIndex, assets, conversation);
    }

    public Project withAssets(List<Asset> assets) {
        return new Project(id, createdAt, domain, versions, deployedIndex, assets, conversation);
    }

    public Project withConversation(JsonNode conversation) {
        return new Project(id, createdAt, domain, versions, deployedIndex, assets, conversation);
    }
}
