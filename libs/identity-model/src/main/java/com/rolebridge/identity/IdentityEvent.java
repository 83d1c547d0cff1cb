package com.rolebridge.identity;

import java.time.Instant;
import java.util.Set;

/**
 * A single identity lifecycle event, delivered at least once.
 *
 * <p>Events are immutable. Redelivery reuses the same {@code eventId}, which is what the pending
 * store deduplicates on.
 *
 * @param eventId unique id of this event instance (UUID)
 * @param type lifecycle event type
 * @param kind whether the subject is a user or a group
 * @param identityId stable identifier of the subject
 * @param name the subject's current name (the new name for {@link IdentityEventType#RENAMED})
 * @param previousName name before a rename, null for other types
 * @param addedMembers user ids of members added (group created / membership changed)
 * @param removedMembers user ids of members removed (membership changed)
 * @param occurredAt when the identity store committed the change
 */
public record IdentityEvent(
        String eventId,
        IdentityEventType type,
        IdentityKind kind,
        String identityId,
        String name,
        String previousName,
        Set<String> addedMembers,
        Set<String> removedMembers,
        Instant occurredAt) {

    public IdentityEvent {
        addedMembers = addedMembers == null ? Set.of() : Set.copyOf(addedMembers);
        removedMembers = removedMembers == null ? Set.of() : Set.copyOf(removedMembers);
    }

    /** Key used for per-identity serialization, e.g. {@code user:42}. */
    public String identityKey() {
        return identityKey(kind, identityId);
    }

    /** Builds the per-identity key for a kind and stable id. */
    public static String identityKey(IdentityKind kind, String identityId) {
        return kind.value() + ":" + identityId;
    }
}
