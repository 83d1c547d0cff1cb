package com.rolebridge.security;

/**
 * Thrown when an identity cannot be given a database role name without risking a collision, either
 * because the derived name is reserved, too long, or already held by an unmanaged role or by a
 * different identity.
 *
 * <p>Fatal for the single synchronization operation that raised it. The identity stays
 * unsynchronized until an operator resolves the conflict.
 */
public class NamingConflictException extends RuntimeException {

    private final String identifier;
    private final String roleName;

    public NamingConflictException(String identifier, String roleName, String reason) {
        super("Naming conflict for '%s' -> role '%s': %s".formatted(identifier, roleName, reason));
        this.identifier = identifier;
        this.roleName = roleName;
    }

    public String identifier() {
        return identifier;
    }

    public String roleName() {
        return roleName;
    }
}
