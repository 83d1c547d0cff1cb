package com.rolebridge.sync;

/**
 * Mutation counters for one event or one reconciliation pass. Confined to the thread doing the
 * work.
 */
final class SyncTally {

    int rolesCreated;
    int rolesRenamed;
    int loginChanges;
    int membershipsGranted;
    int membershipsRevoked;
    int rolesRemoved;
    int removalsPending;
    int membersMissing;
    int conflicts;
    int failures;

    boolean changed() {
        return rolesCreated + rolesRenamed + loginChanges + membershipsGranted + membershipsRevoked
                + rolesRemoved > 0;
    }

    ReconciliationReport toReport() {
        return new ReconciliationReport(
                rolesCreated,
                rolesRenamed,
                loginChanges,
                membershipsGranted,
                membershipsRevoked,
                rolesRemoved,
                removalsPending,
                membersMissing,
                conflicts,
                failures);
    }
}
