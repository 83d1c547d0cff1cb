package com.rolebridge.security.context;

/** Thrown when the session's login role is not allowed to assume the target role. */
public class PrivilegeDeniedException extends PrivilegeContextException {

    private final String roleName;
    private final String sessionRole;

    public PrivilegeDeniedException(String roleName, String sessionRole) {
        this(roleName, sessionRole, null);
    }

    public PrivilegeDeniedException(String roleName, String sessionRole, Throwable cause) {
        super("Session role '%s' may not assume role '%s'".formatted(sessionRole, roleName), cause);
        this.roleName = roleName;
        this.sessionRole = sessionRole;
    }

    public String roleName() {
        return roleName;
    }

    public String sessionRole() {
        return sessionRole;
    }
}
