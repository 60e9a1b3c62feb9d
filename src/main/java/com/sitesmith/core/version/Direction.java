package com.sitesmith.core.version;

import com.sitesmith.core.error.ValidationException;

import java.util.Locale;

/** Step direction when walking a project's version history. */
public enum Direction {
    PREVIOUS,
    NEXT;

    public static Direction parse(String value) {
        if (value == null) {
            throw new ValidationException("Direction is required (previous or next)");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "previous", "prev", "back" -> PREVIOUS;
            case "next", "forward" -> NEXT;
            default -> throw new ValidationException("Unknown direction: " + value);
        };
    }
}
