package com.sitesmith.core.deploy;

import java.util.List;

/**
 * Outcome of a project deletion. {@code success} reflects removal of the
 * local record; external cleanup steps that failed are listed in
 * {@code failures} and left for manual follow-up.
 */
public record TeardownResult(
    boolean success,
    String message,
    List<String> failures
) {

    public TeardownResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean clean() {
        return failures.isEmpty();
    }
}
