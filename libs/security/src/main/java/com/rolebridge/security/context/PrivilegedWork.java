package com.rolebridge.security.context;

/**
 * Unit of work run inside a privilege context.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface PrivilegedWork<T, E extends Exception> {

    T execute() throws E;
}
