package com.rolebridge.identity;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Factory methods for {@link IdentityEvent} instances.
 *
 * <p>Generates the event id and timestamp so identity-store adapters only supply what changed.
 */
public final class IdentityEventFactory {

    private IdentityEventFactory() {
        // utility class
    }

    /** A user was created. */
    public static IdentityEvent userCreated(ApplicationUser user) {
        return event(IdentityEventType.CREATED, IdentityKind.USER, user.id(), user.name(), null,
                Set.of(), Set.of());
    }

    /** A group was created, possibly already holding members. */
    public static IdentityEvent groupCreated(ApplicationGroup group) {
        return event(IdentityEventType.CREATED, IdentityKind.GROUP, group.id(), group.name(), null,
                group.memberIds(), Set.of());
    }

    /** A user or group changed its name. */
    public static IdentityEvent renamed(
            IdentityKind kind, String identityId, String previousName, String newName) {
        return event(IdentityEventType.RENAMED, kind, identityId, newName, previousName,
                Set.of(), Set.of());
    }

    /** A user lost the ability to log in but still exists. */
    public static IdentityEvent deactivated(ApplicationUser user) {
        return event(IdentityEventType.DEACTIVATED, IdentityKind.USER, user.id(), user.name(), null,
                Set.of(), Set.of());
    }

    /** A previously deactivated user may log in again. */
    public static IdentityEvent reactivated(ApplicationUser user) {
        return event(IdentityEventType.REACTIVATED, IdentityKind.USER, user.id(), user.name(), null,
                Set.of(), Set.of());
    }

    /** A user or group was deleted from the identity store. */
    public static IdentityEvent deleted(IdentityKind kind, String identityId, String name) {
        return event(IdentityEventType.DELETED, kind, identityId, name, null, Set.of(), Set.of());
    }

    /** Members were added to and/or removed from a group. */
    public static IdentityEvent membershipChanged(
            ApplicationGroup group, Set<String> added, Set<String> removed) {
        return event(IdentityEventType.MEMBERSHIP_CHANGED, IdentityKind.GROUP, group.id(),
                group.name(), null, added, removed);
    }

    /**
     * Creates a copy of an event carrying only the given members, keeping every other field except
     * the event id. Used when part of a membership change has to be retried later.
     */
    public static IdentityEvent remainder(
            IdentityEvent source, Set<String> added, Set<String> removed) {
        return new IdentityEvent(
                UUID.randomUUID().toString(),
                source.type(),
                source.kind(),
                source.identityId(),
                source.name(),
                source.previousName(),
                added,
                removed,
                source.occurredAt());
    }

    private static IdentityEvent event(
            IdentityEventType type,
            IdentityKind kind,
            String identityId,
            String name,
            String previousName,
            Set<String> added,
            Set<String> removed) {
        return new IdentityEvent(
                UUID.randomUUID().toString(),
                type,
                kind,
                identityId,
                name,
                previousName,
                added,
                removed,
                Instant.now());
    }
}
