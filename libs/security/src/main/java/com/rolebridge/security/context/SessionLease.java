package com.rolebridge.security.context;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One unit of work's exclusive hold on a pooled database session, together with the session's
 * {@link PrivilegeContextManager}.
 *
 * <p>{@link #close()} closes any context left open, then checks that the session is back at its
 * login role. Only then is the session released to the pool; in every other case it is discarded.
 *
 * <pre>{@code
 * try (SessionLease lease = pool.lease()) {
 *     lease.callAs("user_smith", () -> runQueries(lease.session()));
 * }
 * }</pre>
 */
public final class SessionLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLease.class);

    private final DatabaseSession session;
    private final SessionDisposer disposer;
    private final PrivilegeContextManager privileges;
    private final AtomicBoolean discarded = new AtomicBoolean();
    private boolean closed;

    public SessionLease(DatabaseSession session, SessionDisposer disposer, boolean allowNesting) {
        if (disposer == null) {
            throw new IllegalArgumentException("disposer must not be null");
        }
        this.session = session;
        this.disposer = disposer;
        this.privileges = new PrivilegeContextManager(session, allowNesting, this::discardSession);
    }

    public DatabaseSession session() {
        return session;
    }

    public PrivilegeContextManager privileges() {
        return privileges;
    }

    /** Runs {@code work} as {@code roleName} on this lease's session. */
    public <T, E extends Exception> T callAs(String roleName, PrivilegedWork<T, E> work) throws E {
        return privileges.callAs(roleName, work);
    }

    public boolean isDiscarded() {
        return discarded.get();
    }

    /**
     * Ends the lease.
     *
     * @throws SessionRestoreException if the session was not at its default privileges; it has
     *     been discarded when this is thrown
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (privileges.depth() > 0) {
            log.warn("Session lease closed with {} open privilege context(s)", privileges.depth());
            privileges.unwindAll();
        }
        if (privileges.isUnsafe()) {
            return;
        }

        String expected = null;
        String observed = null;
        try {
            expected = privileges.sessionRole();
            observed = session.currentRole();
        } catch (SQLException e) {
            privileges.abandon("could not verify privileges at release: " + e.getMessage());
            throw new SessionRestoreException(expected, observed, e);
        }
        if (!expected.equals(observed)) {
            privileges.abandon("released while running as " + observed);
            throw new SessionRestoreException(expected, observed, null);
        }
        disposer.release(session);
    }

    private void discardSession() {
        if (discarded.compareAndSet(false, true)) {
            disposer.discard(session);
        }
    }
}
