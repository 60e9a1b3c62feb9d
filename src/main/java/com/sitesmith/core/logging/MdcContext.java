package com.sitesmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sitesmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private static final String PROJECT_ID = "projectId";
    private static final String OPERATION = "operation";

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put(PROJECT_ID, projectId);
    }

    public static void setOperation(String projectId, String operation) {
        MDC.put(PROJECT_ID, projectId);
        MDC.put(OPERATION, operation);
    }

    /**
     * Tags the current thread with {@code projectId} and {@code operation} until
     * the returned scope is closed, which puts back whatever was there before.
     * Nested operations therefore hand the outer tags back on exit.
     */
    public static Scope open(String projectId, String operation) {
        var scope = new Scope(MDC.get(PROJECT_ID), MDC.get(OPERATION));
        setOperation(projectId, operation);
        return scope;
    }

    public static void clear() {
        MDC.remove(PROJECT_ID);
        MDC.remove(OPERATION);
    }

    public static final class Scope implements AutoCloseable {

        private final String previousProjectId;
        private final String previousOperation;

        private Scope(String previousProjectId, String previousOperation) {
            this.previousProjectId = previousProjectId;
            this.previousOperation = previousOperation;
        }

        @Override
        public void close() {
            restore(PROJECT_ID, previousProjectId);
            restore(OPERATION, previousOperation);
        }

        private static void restore(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
