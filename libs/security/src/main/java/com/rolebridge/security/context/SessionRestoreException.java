package com.rolebridge.security.context;

/**
 * Thrown when a session's privileges could not be confirmed as restored.
 *
 * <p>By the time this is thrown the session has already been handed to the pool for discarding;
 * it will never serve another unit of work.
 */
public class SessionRestoreException extends RuntimeException {

    private final String expectedRole;
    private final String observedRole;

    public SessionRestoreException(String expectedRole, String observedRole, Throwable cause) {
        super("Session privileges not restored: expected '%s', observed '%s'; session discarded"
                .formatted(expectedRole, observedRole), cause);
        this.expectedRole = expectedRole;
        this.observedRole = observedRole;
    }

    public String expectedRole() {
        return expectedRole;
    }

    /** Role observed after the restore attempt, null if it could not be read. */
    public String observedRole() {
        return observedRole;
    }
}
