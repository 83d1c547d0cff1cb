package com.rolebridge.sync;

import com.rolebridge.identity.IdentityEvent;

import java.time.Instant;

/**
 * An identity event waiting to be retried.
 *
 * @param event the event as it will be replayed
 * @param attempts how many times it has been tried and queued
 * @param lastError why the most recent attempt did not settle
 * @param queuedAt when it was first queued
 */
public record PendingEvent(IdentityEvent event, int attempts, String lastError, Instant queuedAt) {

    public String eventId() {
        return event.eventId();
    }

    public String identityKey() {
        return event.identityKey();
    }
}
