package com.visitsync.model.enums;

/**
 * States of the per-visit reconciliation workflow, in traversal order.
 * FAILED is terminal and reachable from any state.
 */
public enum VisitState {
    LOCATED,
    TIMES_VERIFIED,
    TIMES_FILLED_AND_APPROVED,
    ALREADY_FILLED,
    DOCUMENTS_FETCHED,
    DOCUMENTS_ATTACHED,
    NOT_APPLICABLE,
    COMPLETED,
    FAILED
}
