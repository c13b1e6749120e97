package com.planlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Workflow status of a task. Copied onto graph nodes for reporting only.
 */
public enum TaskStatus {
    NOT_STARTED,
    IN_PROGRESS,
    BLOCKED,
    PENDING_VERIFICATION,
    VERIFIED,
    NEEDS_RECHECK,  // verified once, upstream change requires another pass
    FAILED,
    DECOMPOSED;

    /**
     * Accepts both enum names ("IN_PROGRESS") and the lower-case wire values
     * used by task exports ("in_progress").
     */
    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NOT_STARTED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
