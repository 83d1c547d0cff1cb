package com.rolebridge.sync;

/**
 * What happened to one identity event.
 *
 * @param eventId id of the handled event
 * @param identityKey per-identity key, e.g. {@code user:42}
 * @param status outcome
 * @param message human-readable detail, never null
 */
public record SyncOutcome(String eventId, String identityKey, SyncStatus status, String message) {

    public SyncOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        message = message == null ? "" : message;
    }
}
