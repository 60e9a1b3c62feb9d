package com.sitesmith.core.asset;

/**
 * Produces a short natural-language description of an image.
 */
public interface CaptionService {

    /**
     * @param image       raw uploaded bytes
     * @param contentType MIME type of {@code image}
     * @return caption text, never null; may be blank when the model had nothing to say
     */
    String caption(byte[] image, String contentType);
}
