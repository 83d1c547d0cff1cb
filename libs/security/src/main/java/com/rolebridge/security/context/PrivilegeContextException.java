package com.rolebridge.security.context;

/**
 * Base type for failures to enter a privilege context.
 *
 * <p>When this is thrown from {@code enter}, the context was not entered and the work it guarded
 * must be treated as not having run.
 */
public class PrivilegeContextException extends RuntimeException {

    public PrivilegeContextException(String message) {
        super(message);
    }

    public PrivilegeContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
