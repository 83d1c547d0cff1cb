package com.rolebridge.database.session;

import com.rolebridge.security.context.DatabaseSession;
import com.rolebridge.security.context.SessionDisposer;
import com.rolebridge.security.context.SessionLease;
import com.rolebridge.security.context.SessionPool;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Leases PostgreSQL sessions from a HikariCP pool.
 *
 * <p>Releasing closes the connection, which returns it to Hikari. Discarding evicts it, so Hikari
 * closes it for good and never hands it out again.
 */
public final class HikariSessionPool implements SessionPool, SessionDisposer {

    private static final Logger log = LoggerFactory.getLogger(HikariSessionPool.class);

    private final HikariDataSource dataSource;
    private final boolean allowNesting;

    public HikariSessionPool(HikariDataSource dataSource, boolean allowNesting) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
        this.allowNesting = allowNesting;
    }

    @Override
    public SessionLease lease() throws SQLException {
        Connection connection = dataSource.getConnection();
        return new SessionLease(new PostgresDatabaseSession(connection), this, allowNesting);
    }

    @Override
    public void release(DatabaseSession session) {
        Connection connection = connectionOf(session);
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing leased connection failed; evicting it", e);
            dataSource.evictConnection(connection);
        }
    }

    @Override
    public void discard(DatabaseSession session) {
        log.warn("Evicting connection from pool {}", dataSource.getPoolName());
        dataSource.evictConnection(connectionOf(session));
    }

    private static Connection connectionOf(DatabaseSession session) {
        if (session instanceof PostgresDatabaseSession postgres) {
            return postgres.connection();
        }
        throw new IllegalArgumentException("session was not leased from this pool: " + session);
    }
}
