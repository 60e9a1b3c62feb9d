package com.sitesmith.core.model;

import java.util.List;

/**
 * One page of a project listing.
 */
public record ProjectPage(
    List<Project> items,
    int page,
    int pageSize,
    int totalCount,
    int totalPages
) {}
