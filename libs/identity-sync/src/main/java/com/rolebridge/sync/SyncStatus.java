package com.rolebridge.sync;

/**
 * Result of synchronizing one identity event.
 */
public enum SyncStatus {

    /** At least one role mutation was issued. */
    APPLIED("applied"),

    /** Database state already matched; nothing was issued. */
    UNCHANGED("unchanged"),

    /** The role could not be dropped yet; the deletion is queued for retry. */
    REMOVAL_PENDING("removal_pending"),

    /** Part of the event depends on roles that do not exist yet; the rest is queued for retry. */
    DEFERRED("deferred"),

    /** The identity's role name collides with another role; flagged for operator attention. */
    CONFLICT("conflict"),

    /** The event is malformed and was dropped. */
    REJECTED("rejected"),

    /** The database refused the change; the event is queued for retry. */
    FAILED("failed");

    private final String value;

    SyncStatus(String value) {
        this.value = value;
    }

    /** Lower-case tag value used in metrics. */
    public String value() {
        return value;
    }

    /** Whether the event left nothing further to do. */
    public boolean isSettled() {
        return this == APPLIED || this == UNCHANGED;
    }
}
