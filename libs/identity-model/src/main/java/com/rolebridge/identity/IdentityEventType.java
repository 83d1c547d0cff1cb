package com.rolebridge.identity;

import java.util.Optional;

/**
 * Lifecycle events emitted by the identity store.
 *
 * <p>The {@code value} field holds the canonical string used in JSON serialization and in the
 * pending-event table.
 */
public enum IdentityEventType {
    CREATED("Created"),
    RENAMED("Renamed"),
    DEACTIVATED("Deactivated"),
    REACTIVATED("Reactivated"),
    DELETED("Deleted"),
    MEMBERSHIP_CHANGED("MembershipChanged");

    private final String value;

    IdentityEventType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "MembershipChanged"). */
    public String value() {
        return value;
    }

    /** Whether this event type only makes sense for users. */
    public boolean userOnly() {
        return this == DEACTIVATED || this == REACTIVATED;
    }

    /** Whether this event type only makes sense for groups. */
    public boolean groupOnly() {
        return this == MEMBERSHIP_CHANGED;
    }

    /**
     * Looks up an event type by its canonical string value.
     *
     * @param value the string to match (e.g. "Renamed")
     * @return the matching type, or empty if not found
     */
    public static Optional<IdentityEventType> fromString(String value) {
        for (IdentityEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
