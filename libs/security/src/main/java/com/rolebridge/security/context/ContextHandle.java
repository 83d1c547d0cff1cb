package com.rolebridge.security.context;

/**
 * An entered privilege context. Closing the handle exits the context and restores the privileges
 * that were in effect immediately before it was entered.
 *
 * <p>Use with try-with-resources; {@link #close()} is idempotent.
 */
public final class ContextHandle implements AutoCloseable {

    private final PrivilegeContextManager manager;
    private final PrivilegeContext context;
    private final PrivilegeContext previous;
    private volatile boolean open = true;

    ContextHandle(PrivilegeContextManager manager, PrivilegeContext context, PrivilegeContext previous) {
        this.manager = manager;
        this.context = context;
        this.previous = previous;
    }

    /** The context this handle entered. */
    public PrivilegeContext context() {
        return context;
    }

    /** The context that will be restored on close. */
    public PrivilegeContext previous() {
        return previous;
    }

    public boolean isOpen() {
        return open;
    }

    PrivilegeContextManager manager() {
        return manager;
    }

    void markClosed() {
        open = false;
    }

    @Override
    public void close() {
        manager.exit(this);
    }

    @Override
    public String toString() {
        return "ContextHandle[" + context + " <- " + previous + (open ? "" : ", closed") + "]";
    }
}
