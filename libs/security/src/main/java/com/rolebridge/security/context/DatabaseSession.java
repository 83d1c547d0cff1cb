package com.rolebridge.security.context;

import java.sql.SQLException;

/**
 * The privilege-related surface of one database session (one physical connection).
 *
 * <p>A session is owned by one unit of work at a time. Implementations are not thread-safe.
 */
public interface DatabaseSession {

    /** Role whose privileges are currently in effect ({@code current_user}). */
    String currentRole() throws SQLException;

    /** Role the session authenticated as ({@code session_user}); the default context. */
    String sessionRole() throws SQLException;

    /** Whether a role with this name exists. */
    boolean roleExists(String roleName) throws SQLException;

    /** Whether the session's login role is allowed to switch to this role. */
    boolean canAssume(String roleName) throws SQLException;

    /** Switches effective privileges to {@code roleName}. */
    void assumeRole(String roleName) throws SQLException;

    /** Switches effective privileges back to the session role. */
    void resetRole() throws SQLException;
}
