package com.rolebridge.identity;

/**
 * An application user as seen by the synchronizer.
 *
 * <p>The identity store owns this record; the synchronizer only observes it. {@code id} never
 * changes for the lifetime of the user. {@code name} is the login name the database role is derived
 * from and changes on rename.
 *
 * @param id stable, immutable identifier (primary key in the identity store)
 * @param name login name, source of the derived role name
 * @param displayName human-readable name, not mirrored into the database
 * @param active whether the user may currently log in
 */
public record ApplicationUser(String id, String name, String displayName, boolean active) {

    /** Creates an active user whose display name equals its login name. */
    public static ApplicationUser active(String id, String name) {
        return new ApplicationUser(id, name, name, true);
    }

    /** Returns a copy with a new login name. */
    public ApplicationUser withName(String newName) {
        return new ApplicationUser(id, newName, displayName, active);
    }

    /** Returns a copy with the given active flag. */
    public ApplicationUser withActive(boolean newActive) {
        return new ApplicationUser(id, name, displayName, newActive);
    }
}
