package com.rolebridge.sync;

import com.rolebridge.identity.IdentityEvent;

import java.util.List;

/**
 * Durable queue of identity events whose synchronization has to be retried.
 *
 * <p>Events are keyed by event id: queuing an event that is already queued records another attempt
 * instead of adding a duplicate. Nothing is removed except by {@link #remove}.
 */
public interface PendingEventStore {

    /**
     * Queues {@code event}, or records another failed attempt if it is already queued.
     *
     * @param reason why the event could not be settled
     */
    void enqueue(IdentityEvent event, String reason);

    /**
     * Removes an event.
     *
     * @return true if it was queued
     */
    boolean remove(String eventId);

    /** All queued events, oldest first. */
    List<PendingEvent> pending();

    /** Queued events for one identity, oldest first. */
    List<PendingEvent> pendingFor(String identityKey);

    /** Number of queued events. */
    int size();
}
