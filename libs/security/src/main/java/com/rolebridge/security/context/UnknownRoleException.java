package com.rolebridge.security.context;

/** Thrown when the target role of a privilege context does not exist. */
public class UnknownRoleException extends PrivilegeContextException {

    private final String roleName;

    public UnknownRoleException(String roleName) {
        this(roleName, null);
    }

    public UnknownRoleException(String roleName, Throwable cause) {
        super("Role '%s' does not exist".formatted(roleName), cause);
        this.roleName = roleName;
    }

    public String roleName() {
        return roleName;
    }
}
