package com.visitsync.exception;

import com.visitsync.model.enums.ReconciliationError;

/**
 * Base class for classified reconciliation failures. Loop boundaries catch
 * these and downgrade them to log entries.
 */
public class ReconciliationException extends RuntimeException {

    private final ReconciliationError error;

    public ReconciliationException(ReconciliationError error, String message) {
        super(message);
        this.error = error;
    }

    public ReconciliationException(ReconciliationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ReconciliationError getError() {
        return error;
    }
}
