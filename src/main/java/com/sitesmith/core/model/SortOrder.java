package com.sitesmith.core.model;

import java.util.Locale;

/**
 * Ordering of project listings by creation time.
 */
public enum SortOrder {
    ASC,
    DESC;

    /** Parses {@code asc}/{@code desc} case-insensitively; anything else is {@link #DESC}. */
    public static SortOrder parse(String value) {
        if (value != null && "asc".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return ASC;
        }
        return DESC;
    }
}
