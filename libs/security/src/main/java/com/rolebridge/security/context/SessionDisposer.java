package com.rolebridge.security.context;

/** Pool-side callbacks for ending a {@link SessionLease}. */
public interface SessionDisposer {

    /** Returns a session whose privileges are confirmed to be at the session default. */
    void release(DatabaseSession session);

    /** Destroys a session whose privilege state is unknown or wrong. */
    void discard(DatabaseSession session);
}
