package com.rolebridge.security.role;

/**
 * Thrown by a {@link RoleCatalog} when a role cannot be dropped yet because it still owns objects,
 * holds privileges that depend on it, or is used by a live session.
 *
 * <p>This is not a failure of the deletion: the caller keeps the deletion pending and retries.
 */
public class RoleRemovalBlockedException extends RuntimeException {

    private final String roleName;

    public RoleRemovalBlockedException(String roleName, String reason) {
        this(roleName, reason, null);
    }

    public RoleRemovalBlockedException(String roleName, String reason, Throwable cause) {
        super("Removal of role '%s' is blocked: %s".formatted(roleName, reason), cause);
        this.roleName = roleName;
    }

    public String roleName() {
        return roleName;
    }
}
