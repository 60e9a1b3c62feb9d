package com.sitesmith.core.asset;

/** Image bytes in the canonical encoding, ready for upload. */
public record NormalizedImage(byte[] content, String filename, String contentType) {}
