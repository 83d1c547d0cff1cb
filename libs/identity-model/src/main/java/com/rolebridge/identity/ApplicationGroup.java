package com.rolebridge.identity;

import java.util.Set;

/**
 * An application group and its members.
 *
 * @param id stable, immutable identifier
 * @param name group name, source of the derived role name
 * @param memberIds stable ids of the users in this group
 */
public record ApplicationGroup(String id, String name, Set<String> memberIds) {

    public ApplicationGroup {
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
    }

    /** Creates a group with no members. */
    public static ApplicationGroup empty(String id, String name) {
        return new ApplicationGroup(id, name, Set.of());
    }
}
