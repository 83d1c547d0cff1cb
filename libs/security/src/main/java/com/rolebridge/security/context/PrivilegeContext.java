package com.rolebridge.security.context;

/**
 * Target privilege level for a unit of work: either a named database role or {@link #DEFAULT}, the
 * identity the session was opened with.
 *
 * @param roleName role to assume, null for {@link #DEFAULT}
 */
public record PrivilegeContext(String roleName) {

    /** The session's original (login) identity. */
    public static final PrivilegeContext DEFAULT = new PrivilegeContext(null);

    /**
     * Context that assumes the given role.
     *
     * @throws IllegalArgumentException if roleName is null or blank
     */
    public static PrivilegeContext of(String roleName) {
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("roleName must not be null or blank");
        }
        return new PrivilegeContext(roleName);
    }

    public boolean isDefault() {
        return roleName == null;
    }

    @Override
    public String toString() {
        return isDefault() ? "<default>" : roleName;
    }
}
