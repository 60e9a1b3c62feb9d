package com.sitesmith.dispatch.api;

/**
 * Inbound JSON body for appending or editing a version.
 *
 * @param html full HTML document
 */
public record HtmlRequest(String html) {}
