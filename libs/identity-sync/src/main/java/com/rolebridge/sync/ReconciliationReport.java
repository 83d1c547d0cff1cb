package com.rolebridge.sync;

/**
 * Totals from one {@link IdentitySynchronizer#reconcile} pass.
 *
 * @param rolesCreated roles created for identities that had none
 * @param rolesRenamed roles renamed to match the identity's current name
 * @param loginChanges roles whose login capability was switched
 * @param membershipsGranted membership edges added
 * @param membershipsRevoked membership edges removed
 * @param rolesRemoved roles dropped because their identity no longer exists
 * @param removalsPending roles whose drop was blocked and queued
 * @param membersMissing group members skipped because their role does not exist
 * @param conflicts identities left unsynchronized by a naming conflict
 * @param failures identities whose synchronization failed for another reason
 */
public record ReconciliationReport(
        int rolesCreated,
        int rolesRenamed,
        int loginChanges,
        int membershipsGranted,
        int membershipsRevoked,
        int rolesRemoved,
        int removalsPending,
        int membersMissing,
        int conflicts,
        int failures) {

    /** Whether the pass converged with nothing left over. */
    public boolean isClean() {
        return removalsPending == 0 && membersMissing == 0 && conflicts == 0 && failures == 0;
    }

    /** Whether the pass issued no mutation at all. */
    public boolean isNoop() {
        return rolesCreated + rolesRenamed + loginChanges + membershipsGranted + membershipsRevoked
                + rolesRemoved == 0;
    }
}
