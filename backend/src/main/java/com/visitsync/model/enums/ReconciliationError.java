package com.visitsync.model.enums;

/**
 * Failure taxonomy for visit and insertion workflows.
 */
public enum ReconciliationError {
    NOT_FOUND("not found"),
    NO_SCHEDULED_TIME("no scheduled time"),
    THERAPIST_UNMATCHED("therapist unmatched"),
    NAVIGATION_STALE("navigation stale"),
    UNEXPECTED("unexpected failure");

    private final String label;

    ReconciliationError(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Benign failures are expected preconditions, logged below warning level.
     */
    public boolean isBenign() {
        return this == NO_SCHEDULED_TIME;
    }
}
