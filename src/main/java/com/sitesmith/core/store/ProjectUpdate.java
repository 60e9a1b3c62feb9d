package com.sitesmith.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitesmith.core.model.Asset;
import com.sitesmith.core.model.HtmlVersion;
import com.sitesmith.core.model.Project;

import java.util.List;

/**
 * Partial set of project fields to merge into an existing record. Null
 * components leave the stored value untouched; {@code id}, {@code createdAt}
 * and {@code domain} can never be changed.
 */
public record ProjectUpdate(
    List<HtmlVersion> versions,
    Integer deployedIndex,
    List<Asset> assets,
    JsonNode conversation
) {

    public static ProjectUpdate versions(List<HtmlVersion> versions) {
        return new ProjectUpdate(versions, null, null, null);
    }

    public static ProjectUpdate deployedIndex(int deployedIndex) {
        return new ProjectUpdate(null, deployedIndex, null, null);
    }

    public static ProjectUpdate assets(List<Asset> assets) {
        return new ProjectUpdate(null, null, assets, null);
    }

    public static ProjectUpdate conversation(JsonNode conversation) {
        return new ProjectUpdate(null, null, null, conversation);
    }

    Project applyTo(Project project) {
        Project merged = project;
        if (versions != null) merged = merged.withVersions(versions);
        if (deployedIndex != null) merged = merged.withDeployedIndex(deployedIndex);
        if (assets != null) merged = merged.withAssets(assets);
        if (conversation != null) merged = merged.withConversation(conversation);
        return merged;
    }
}
