package com.visitsync.exception;

import com.visitsync.model.enums.ReconciliationError;

/**
 * No record in the target system matches the requested visit.
 */
public class VisitNotFoundException extends ReconciliationException {

    public VisitNotFoundException(String message) {
        super(ReconciliationError.NOT_FOUND, message);
    }
}
