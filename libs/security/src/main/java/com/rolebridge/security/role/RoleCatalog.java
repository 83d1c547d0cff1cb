package com.rolebridge.security.role;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read and write access to the database's role catalog.
 *
 * <p>Write operations are plain primitives; upsert and idempotence decisions belong to the caller.
 * Implementations never touch a role the caller did not name.
 */
public interface RoleCatalog {

    /** Looks up a role by name, managed or not. */
    Optional<DatabaseRole> findRole(String name);

    /** Looks up the managed role carrying the marker for the given identity. */
    Optional<DatabaseRole> findManagedRole(RoleKind kind, String identityId);

    /** All roles carrying a RoleBridge marker. */
    List<DatabaseRole> managedRoles();

    /** Names of the roles that are direct members of {@code roleName}. */
    Set<String> membersOf(String roleName);

    /**
     * Creates a role and tags it with its marker in one step.
     *
     * @throws IllegalStateException if a role with that name already exists
     */
    void createRole(String name, RoleKind kind, String identityId, boolean loginCapable);

    /** Renames a role in place, keeping its memberships and grants. */
    void renameRole(String currentName, String newName);

    /** Grants or revokes the ability to open a session. */
    void setLogin(String name, boolean loginCapable);

    /** Makes {@code memberRole} a member of {@code groupRole}. No-op if it already is. */
    void grantMembership(String groupRole, String memberRole);

    /** Removes {@code memberRole} from {@code groupRole}. No-op if it is not a member. */
    void revokeMembership(String groupRole, String memberRole);

    /**
     * Drops a role.
     *
     * @throws RoleRemovalBlockedException if the role still owns objects or has live sessions
     */
    void dropRole(String name);
}
