package com.rolebridge.database.session;

import static com.rolebridge.database.SqlIdentifiers.quote;

import com.rolebridge.security.context.DatabaseSession;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A {@link DatabaseSession} on one PostgreSQL connection.
 *
 * <p>{@code SET ROLE} issued inside a transaction that later rolls back is undone with it; callers
 * relying on a context across transactions must run in auto-commit mode or re-check the role.
 */
public final class PostgresDatabaseSession implements DatabaseSession {

    private final Connection connection;

    public PostgresDatabaseSession(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        this.connection = connection;
    }

    /** The underlying connection, for running queries inside a privilege context. */
    public Connection connection() {
        return connection;
    }

    @Override
    public String currentRole() throws SQLException {
        return queryString("SELECT current_user");
    }

    @Override
    public String sessionRole() throws SQLException {
        return queryString("SELECT session_user");
    }

    @Override
    public boolean roleExists(String roleName) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT 1 FROM pg_roles WHERE rolname = ?")) {
            ps.setString(1, roleName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean canAssume(String roleName) throws SQLException {
        try (PreparedStatement ps =
                connection.prepareStatement("SELECT pg_has_role(session_user, ?, 'MEMBER')")) {
            ps.setString(1, roleName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    @Override
    public void assumeRole(String roleName) throws SQLException {
        execute("SET ROLE " + quote(roleName));
    }

    @Override
    public void resetRole() throws SQLException {
        execute("RESET ROLE");
    }

    private String queryString(String sql) throws SQLException {
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) {
                throw new SQLException("no row returned by: " + sql);
            }
            return rs.getString(1);
        }
    }

    private void execute(String sql) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(sql);
        }
    }
}
