package com.rolebridge.security;

import com.rolebridge.security.role.RoleKind;

import java.util.Optional;

/**
 * Maps an application identity to the name of the database role that mirrors it.
 *
 * <p>Implementations are pure: the same input always yields the same name, across restarts, so
 * replaying synchronization never produces a second role for the same identity. Distinct
 * {@code (kind, identifier)} pairs never map to the same name.
 */
public interface RoleNamingPolicy {

    /**
     * Derives the role name.
     *
     * @param kind {@link RoleKind#USER_ROLE} or {@link RoleKind#GROUP_ROLE}
     * @param identifier the identity's name
     * @return the database role name
     * @throws NamingConflictException if the derived name could collide with a reserved or
     *     unmanaged role, or cannot be represented without losing uniqueness
     * @throws IllegalArgumentException if {@code kind} is UNMANAGED or the identifier is blank
     */
    String roleName(RoleKind kind, String identifier);

    /**
     * Reverses {@link #roleName}.
     *
     * @param roleName a database role name
     * @return the kind and identifier it was derived from, or empty if this policy could not have
     *     produced it
     */
    Optional<RoleIdentity> identityOf(String roleName);

    /**
     * Kind and identifier recovered from a role name.
     *
     * @param kind managed role kind
     * @param identifier the identity's name
     */
    record RoleIdentity(RoleKind kind, String identifier) {}
}
