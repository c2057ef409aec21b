package com.visitsync.exception;

import com.visitsync.model.enums.ReconciliationError;

/**
 * No System A therapist option reached the surname-match threshold.
 */
public class TherapistUnmatchedException extends ReconciliationException {

    public TherapistUnmatchedException(String message) {
        super(ReconciliationError.THERAPIST_UNMATCHED, message);
    }
}
