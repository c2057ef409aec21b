package com.visitsync.exception;

import com.visitsync.model.enums.ReconciliationError;

/**
 * A session is not showing the view the workflow expects, even after recovery.
 */
public class NavigationStaleException extends ReconciliationException {

    public NavigationStaleException(String message) {
        super(ReconciliationError.NAVIGATION_STALE, message);
    }
}
