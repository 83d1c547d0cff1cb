package com.rolebridge.security.context;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped switching of one database session's effective privileges.
 *
 * <p>Every {@link #enter} returns a {@link ContextHandle}; closing it restores the privileges that
 * were observed immediately before the matching {@code enter}, on every exit path. Contexts form a
 * single stack per session: entering B inside A and then exiting B returns to A, not to the
 * session default.
 *
 * <p>Safety rules:
 *
 * <ul>
 *   <li>If a switch fails, {@code enter} throws and the guarded work never runs.
 *   <li>If a restore fails or cannot be confirmed, the session is marked unsafe and handed to the
 *       discard callback before {@link SessionRestoreException} is thrown. An unsafe manager
 *       refuses all further use.
 *   <li>While any context is open, only the thread that entered the first one may enter or exit.
 * </ul>
 *
 * <p>A manager belongs to exactly one session. Obtain it through {@link SessionLease} so the
 * discard callback is wired to the pool.
 */
public final class PrivilegeContextManager {

    private static final Logger log = LoggerFactory.getLogger(PrivilegeContextManager.class);

    /** SQLSTATE insufficient_privilege. */
    static final String SQLSTATE_INSUFFICIENT_PRIVILEGE = "42501";

    /** SQLSTATE undefined_object. */
    static final String SQLSTATE_UNDEFINED_OBJECT = "42704";

    private final DatabaseSession session;
    private final boolean allowNesting;
    private final Runnable discard;
    private final Deque<ContextHandle> stack = new ArrayDeque<>();

    private Thread owner;
    private boolean unsafe;
    private String sessionRole;

    /**
     * @param session the session whose privileges are switched
     * @param allowNesting whether {@code enter} may be called while a context is open
     * @param discard invoked once when the session must never be reused
     */
    public PrivilegeContextManager(DatabaseSession session, boolean allowNesting, Runnable discard) {
        if (session == null) {
            throw new IllegalArgumentException("session must not be null");
        }
        if (discard == null) {
            throw new IllegalArgumentException("discard must not be null");
        }
        this.session = session;
        this.allowNesting = allowNesting;
        this.discard = discard;
    }

    /** Shorthand for {@code enter(PrivilegeContext.of(roleName))}. */
    public ContextHandle enter(String roleName) {
        return enter(PrivilegeContext.of(roleName));
    }

    /**
     * Switches the session to {@code target}.
     *
     * @return handle whose {@code close()} restores the previous privileges
     * @throws UnknownRoleException if the target role does not exist
     * @throws PrivilegeDeniedException if the session may not assume the target role
     * @throws AlreadyInContextException if a context is open and nesting is disabled
     * @throws PrivilegeContextException if the session could not be inspected or switched
     * @throws IllegalStateException if the session is unsafe or owned by another thread
     */
    public synchronized ContextHandle enter(PrivilegeContext target) {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        requireUsable();
        requireOwner("enter");
        if (!stack.isEmpty() && !allowNesting) {
            throw new AlreadyInContextException(target, stack.peek().context());
        }

        PrivilegeContext previous = observe();
        if (!target.isDefault()) {
            checkAssumable(target.roleName());
        }
        switchTo(target, previous);

        ContextHandle handle = new ContextHandle(this, target, previous);
        if (stack.isEmpty()) {
            owner = Thread.currentThread();
        }
        stack.push(handle);
        log.debug("Entered privilege context {} (depth {}, restores {})", target, stack.size(), previous);
        return handle;
    }

    /**
     * Runs {@code work} inside {@code target} and restores the previous privileges afterwards,
     * whether the work returns or throws.
     */
    public <T, E extends Exception> T callAs(PrivilegeContext target, PrivilegedWork<T, E> work)
            throws E {
        try (ContextHandle ignored = enter(target)) {
            return work.execute();
        }
    }

    /** Shorthand for {@code callAs(PrivilegeContext.of(roleName), work)}. */
    public <T, E extends Exception> T callAs(String roleName, PrivilegedWork<T, E> work) throws E {
        return callAs(PrivilegeContext.of(roleName), work);
    }

    /** Number of open contexts. */
    public synchronized int depth() {
        return stack.size();
    }

    /** The innermost open context, or {@link PrivilegeContext#DEFAULT} if none is open. */
    public synchronized PrivilegeContext current() {
        return stack.isEmpty() ? PrivilegeContext.DEFAULT : stack.peek().context();
    }

    /** Whether the session has been given up for discarding. */
    public synchronized boolean isUnsafe() {
        return unsafe;
    }

    /**
     * Exits {@code handle}. Contexts entered after it and still open are closed with it; the
     * session returns to the privileges observed before {@code handle} was entered.
     */
    public synchronized void exit(ContextHandle handle) {
        if (handle.manager() != this) {
            throw new IllegalArgumentException("handle belongs to a different session");
        }
        if (!handle.isOpen() || !stack.contains(handle)) {
            return;
        }
        if (owner != Thread.currentThread()) {
            markUnsafe("context exited from thread " + Thread.currentThread().getName()
                    + " while owned by " + owner.getName());
            throw new IllegalStateException(
                    "privilege context exited from a thread that does not own it; session discarded");
        }
        while (stack.peek() != handle) {
            ContextHandle inner = stack.pop();
            inner.markClosed();
            log.warn("Privilege context {} was still open when {} exited", inner.context(), handle.context());
        }
        stack.pop();
        handle.markClosed();
        if (stack.isEmpty()) {
            owner = null;
        }
        restore(handle.previous());
        log.debug("Exited privilege context {} (depth {})", handle.context(), stack.size());
    }

    /**
     * Closes every open context. Called when the session is about to leave its unit of work. From a
     * thread that does not own the contexts, the session is discarded instead of restored.
     */
    synchronized void unwindAll() {
        if (stack.isEmpty() || unsafe) {
            return;
        }
        if (owner != Thread.currentThread()) {
            markUnsafe("open privilege contexts abandoned by their owner thread");
            return;
        }
        exit(stack.peekLast());
    }

    /** Gives the session up: no restore is attempted and it must not be reused. */
    synchronized void abandon(String reason) {
        markUnsafe(reason);
    }

    /** Session role, read once. */
    synchronized String sessionRole() throws SQLException {
        if (sessionRole == null) {
            sessionRole = session.sessionRole();
        }
        return sessionRole;
    }

    private PrivilegeContext observe() {
        try {
            String current = session.currentRole();
            return current.equals(sessionRole()) ? PrivilegeContext.DEFAULT : PrivilegeContext.of(current);
        } catch (SQLException e) {
            throw new PrivilegeContextException("Could not read current session privileges", e);
        }
    }

    private void checkAssumable(String roleName) {
        try {
            if (!session.roleExists(roleName)) {
                throw new UnknownRoleException(roleName);
            }
            if (!session.canAssume(roleName)) {
                throw new PrivilegeDeniedException(roleName, sessionRole());
            }
        } catch (SQLException e) {
            throw new PrivilegeContextException("Could not check role '" + roleName + "'", e);
        }
    }

    private void switchTo(PrivilegeContext target, PrivilegeContext previous) {
        try {
            if (target.isDefault()) {
                session.resetRole();
            } else {
                session.assumeRole(target.roleName());
            }
        } catch (SQLException e) {
            PrivilegeContextException failure = translate(target, e);
            try {
                confirm(previous);
            } catch (SessionRestoreException restoreFailure) {
                failure.addSuppressed(restoreFailure);
            }
            throw failure;
        }
    }

    private PrivilegeContextException translate(PrivilegeContext target, SQLException e) {
        String state = e.getSQLState();
        if (SQLSTATE_INSUFFICIENT_PRIVILEGE.equals(state)) {
            return new PrivilegeDeniedException(target.roleName(), sessionRoleOrUnknown(), e);
        }
        if (SQLSTATE_UNDEFINED_OBJECT.equals(state)) {
            return new UnknownRoleException(target.roleName(), e);
        }
        return new PrivilegeContextException("Could not switch session to '" + target + "'", e);
    }

    private void restore(PrivilegeContext previous) {
        if (unsafe) {
            return;
        }
        try {
            if (previous.isDefault()) {
                session.resetRole();
            } else {
                session.assumeRole(previous.roleName());
            }
        } catch (SQLException e) {
            markUnsafe("restore to " + previous + " failed: " + e.getMessage());
            throw new SessionRestoreException(expectedRoleOrUnknown(previous), null, e);
        }
        confirm(previous);
    }

    /** Verifies the session is at {@code expected}; discards it otherwise. */
    private void confirm(PrivilegeContext expected) {
        String expectedRole = expectedRoleOrUnknown(expected);
        String observed;
        try {
            observed = session.currentRole();
        } catch (SQLException e) {
            markUnsafe("could not confirm privileges: " + e.getMessage());
            throw new SessionRestoreException(expectedRole, null, e);
        }
        if (!observed.equals(expectedRole)) {
            markUnsafe("expected " + expectedRole + " but session is " + observed);
            throw new SessionRestoreException(expectedRole, observed, null);
        }
    }

    private String expectedRoleOrUnknown(PrivilegeContext context) {
        return context.isDefault() ? sessionRoleOrUnknown() : context.roleName();
    }

    private String sessionRoleOrUnknown() {
        try {
            return sessionRole();
        } catch (SQLException e) {
            return "<unknown>";
        }
    }

    private void markUnsafe(String reason) {
        if (unsafe) {
            return;
        }
        unsafe = true;
        for (ContextHandle open : stack) {
            open.markClosed();
        }
        stack.clear();
        owner = null;
        log.error("Discarding database session: {}", reason);
        discard.run();
    }

    private void requireUsable() {
        if (unsafe) {
            throw new IllegalStateException("session has been discarded and cannot switch privileges");
        }
    }

    private void requireOwner(String operation) {
        if (!stack.isEmpty() && owner != Thread.currentThread()) {
            throw new IllegalStateException(
                    "cannot " + operation + ": privilege contexts on this session are owned by thread "
                            + owner.getName());
        }
    }
}
