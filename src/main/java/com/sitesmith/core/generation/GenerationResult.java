package com.sitesmith.core.generation;

import java.util.List;

/**
 * Outcome of a website generation step.
 *
 * @param htmlVersionId id of the version appended for this step
 * @param versionIndex  position of that version in the project history
 * @param usedAssetIds  requested asset ids that exist on the project
 * @param deployedUrl   live URL when the version was published, otherwise null
 */
public record GenerationResult(
    boolean success,
    String message,
    String htmlVersionId,
    int versionIndex,
    List<String> usedAssetIds,
    String deployedUrl
) {

    public GenerationResult {
        usedAssetIds = usedAssetIds == null ? List.of() : List.copyOf(usedAssetIds);
    }
}
