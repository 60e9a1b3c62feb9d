package com.sitesmith.core.generation;

import java.util.List;

/**
 * Authors HTML documents. Implementations are opaque: the caller stores
 * whatever full document comes back and never parses or diffs it.
 */
public interface TextGenerator {

    /**
     * Produces a complete document.
     *
     * @param currentDocument document to revise, or null to start from scratch
     */
    String generate(String currentDocument, String instructions, String context, List<AssetRef> assets);

    /**
     * Produces a complete document in which only the named section of
     * {@code currentDocument} has been rewritten.
     */
    String patchSection(String currentDocument, String sectionName, String instructions, String context,
                        List<AssetRef> assets);
}
