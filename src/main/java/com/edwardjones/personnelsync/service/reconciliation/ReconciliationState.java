package com.edwardjones.personnelsync.service.reconciliation;

/**
 * Steps of a single reconciliation run. A failed fetch goes straight to {@link #DONE}.
 */
public enum ReconciliationState {
    IDLE,
    FETCHING_SOURCE,
    PROJECTING,
    FETCHING_DESTINATION,
    DIFFING,
    DRY_RUN_REPORTING,
    APPLYING,
    DONE
}
