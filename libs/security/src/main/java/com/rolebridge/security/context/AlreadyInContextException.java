package com.rolebridge.security.context;

/** Thrown by a non-nesting {@link PrivilegeContextManager} when a context is already active. */
public class AlreadyInContextException extends PrivilegeContextException {

    private final PrivilegeContext requested;
    private final PrivilegeContext active;

    public AlreadyInContextException(PrivilegeContext requested, PrivilegeContext active) {
        super("Cannot enter '%s': session is already in context '%s' and nesting is disabled"
                .formatted(requested, active));
        this.requested = requested;
        this.active = active;
    }

    public PrivilegeContext requested() {
        return requested;
    }

    public PrivilegeContext active() {
        return active;
    }
}
