package com.visitsync.exception;

import com.visitsync.model.enums.ReconciliationError;

/**
 * The matched System B visit has no time scheduled yet.
 */
public class NoScheduledTimeException extends ReconciliationException {

    public NoScheduledTimeException(String message) {
        super(ReconciliationError.NO_SCHEDULED_TIME, message);
    }
}
