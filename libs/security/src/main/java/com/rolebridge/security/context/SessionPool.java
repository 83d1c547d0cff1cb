package com.rolebridge.security.context;

import java.sql.SQLException;

/**
 * Source of database sessions for units of work.
 *
 * <p>A session leased from the pool is returned to it only once its privileges are confirmed to be
 * back at the session default; otherwise it is discarded.
 */
public interface SessionPool {

    /** Leases a session for one unit of work. Close the lease when the work is done. */
    SessionLease lease() throws SQLException;
}
