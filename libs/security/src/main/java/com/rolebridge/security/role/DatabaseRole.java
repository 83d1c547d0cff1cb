package com.rolebridge.security.role;

import java.util.Set;

/**
 * Snapshot of one database role.
 *
 * @param name role name as stored in the database
 * @param kind USER_ROLE, GROUP_ROLE or UNMANAGED
 * @param identityId stable id of the mirrored identity, null for UNMANAGED roles
 * @param loginCapable whether the role may open a session
 * @param memberOf names of the roles this role is a direct member of
 */
public record DatabaseRole(
        String name, RoleKind kind, String identityId, boolean loginCapable, Set<String> memberOf) {

    public DatabaseRole {
        memberOf = memberOf == null ? Set.of() : Set.copyOf(memberOf);
    }

    public boolean isManaged() {
        return kind.isManaged();
    }

    /** Whether this role is the managed role of the given identity. */
    public boolean belongsTo(RoleKind expectedKind, String expectedIdentityId) {
        return kind == expectedKind && expectedIdentityId.equals(identityId);
    }

    /** Builds a role from a name and the stored marker text. */
    public static DatabaseRole fromMarker(
            String name, String markerText, boolean loginCapable, Set<String> memberOf) {
        return RoleMarker.parse(markerText)
                .map(m -> new DatabaseRole(name, m.kind(), m.identityId(), loginCapable, memberOf))
                .orElseGet(() -> new DatabaseRole(name, RoleKind.UNMANAGED, null, loginCapable, memberOf));
    }
}
