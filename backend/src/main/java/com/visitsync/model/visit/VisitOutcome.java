package com.visitsync.model.visit;

import com.visitsync.model.enums.ReconciliationError;
import com.visitsync.model.enums.VisitState;

import java.util.List;

/**
 * Result of driving one outstanding visit through the reconciliation workflow.
 *
 * @param visit  the System A visit
 * @param path   states traversed, in order; the last entry is the terminal state
 * @param error  failure classification, null when completed
 * @param reason human-readable failure reason, null when completed
 */
public record VisitOutcome(
        VisitRecord visit,
        List<VisitState> path,
        ReconciliationError error,
        String reason) {

    public static VisitOutcome completed(VisitRecord visit, List<VisitState> path) {
        return new VisitOutcome(visit, List.copyOf(path), null, null);
    }

    public static VisitOutcome failed(VisitRecord visit, List<VisitState> path,
                                      ReconciliationError error, String reason) {
        return new VisitOutcome(visit, List.copyOf(path), error, reason);
    }

    public boolean isCompleted() {
        return error == null;
    }

    public VisitState terminalState() {
        return isCompleted() ? VisitState.COMPLETED : VisitState.FAILED;
    }

    public boolean passedThrough(VisitState state) {
        return path.contains(state);
    }
}
