package com.rolebridge.database.role;

import static com.rolebridge.database.SqlIdentifiers.literal;
import static com.rolebridge.database.SqlIdentifiers.quote;

import com.rolebridge.database.SqlStates;
import com.rolebridge.security.role.DatabaseRole;
import com.rolebridge.security.role.RoleCatalog;
import com.rolebridge.security.role.RoleKind;
import com.rolebridge.security.role.RoleMarker;
import com.rolebridge.security.role.RoleRemovalBlockedException;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link RoleCatalog} over PostgreSQL's {@code pg_roles} / {@code pg_auth_members}.
 *
 * <p>The marker tying a role to an application identity is stored as the role's comment
 * ({@code COMMENT ON ROLE}); it is written in the same transaction as {@code CREATE ROLE}, so a
 * role is never visible without it.
 *
 * <p>The connecting user needs {@code CREATEROLE}.
 */
public class PostgresRoleCatalog implements RoleCatalog {

    private static final Logger log = LoggerFactory.getLogger(PostgresRoleCatalog.class);

    static final String SELECT_ROLES = """
            SELECT r.rolname,
                   r.rolcanlogin,
                   shobj_description(r.oid, 'pg_authid') AS marker,
                   ARRAY(SELECT g.rolname
                           FROM pg_auth_members m
                           JOIN pg_roles g ON g.oid = m.roleid
                          WHERE m.member = r.oid
                          ORDER BY g.rolname) AS member_of
              FROM pg_roles r
            """;

    static final String FIND_BY_NAME = SELECT_ROLES + " WHERE r.rolname = ?";

    static final String FIND_BY_MARKER =
            SELECT_ROLES + " WHERE shobj_description(r.oid, 'pg_authid') = ?";

    static final String FIND_MANAGED = SELECT_ROLES
            + " WHERE shobj_description(r.oid, 'pg_authid') LIKE '" + RoleMarker.PREFIX + "%'"
            + " ORDER BY r.rolname";

    static final String MEMBERS_OF = """
            SELECT m.rolname
              FROM pg_auth_members am
              JOIN pg_roles g ON g.oid = am.roleid
              JOIN pg_roles m ON m.oid = am.member
             WHERE g.rolname = ?
             ORDER BY m.rolname
            """;

    static final String ACTIVE_SESSIONS =
            "SELECT count(*) FROM pg_stat_activity WHERE usename = ? AND pid <> pg_backend_pid()";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public PostgresRoleCatalog(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public Optional<DatabaseRole> findRole(String name) {
        return jdbc.query(FIND_BY_NAME, ROLE_MAPPER, name).stream().findFirst();
    }

    @Override
    public Optional<DatabaseRole> findManagedRole(RoleKind kind, String identityId) {
        String marker = new RoleMarker(kind, identityId).text();
        List<DatabaseRole> roles = jdbc.query(FIND_BY_MARKER, ROLE_MAPPER, marker);
        if (roles.size() > 1) {
            log.warn("Marker {} is carried by {} roles; using {}", marker, roles.size(), roles.get(0).name());
        }
        return roles.stream().findFirst();
    }

    @Override
    public List<DatabaseRole> managedRoles() {
        return jdbc.query(FIND_MANAGED, ROLE_MAPPER);
    }

    @Override
    public Set<String> membersOf(String roleName) {
        return new LinkedHashSet<>(jdbc.queryForList(MEMBERS_OF, String.class, roleName));
    }

    @Override
    public void createRole(String name, RoleKind kind, String identityId, boolean loginCapable) {
        String marker = new RoleMarker(kind, identityId).text();
        try {
            transactions.executeWithoutResult(status -> {
                jdbc.execute("CREATE ROLE " + quote(name) + (loginCapable ? " LOGIN" : " NOLOGIN"));
                jdbc.execute("COMMENT ON ROLE " + quote(name) + " IS " + literal(marker));
            });
        } catch (DataAccessException e) {
            if (SqlStates.DUPLICATE_OBJECT.equals(SqlStates.of(e))) {
                throw new IllegalStateException("role \"" + name + "\" already exists", e);
            }
            throw e;
        }
    }

    @Override
    public void renameRole(String currentName, String newName) {
        jdbc.execute("ALTER ROLE " + quote(currentName) + " RENAME TO " + quote(newName));
    }

    @Override
    public void setLogin(String name, boolean loginCapable) {
        jdbc.execute("ALTER ROLE " + quote(name) + (loginCapable ? " LOGIN" : " NOLOGIN"));
    }

    @Override
    public void grantMembership(String groupRole, String memberRole) {
        jdbc.execute("GRANT " + quote(groupRole) + " TO " + quote(memberRole));
    }

    @Override
    public void revokeMembership(String groupRole, String memberRole) {
        jdbc.execute("REVOKE " + quote(groupRole) + " FROM " + quote(memberRole));
    }

    @Override
    public void dropRole(String name) {
        Integer sessions = jdbc.queryForObject(ACTIVE_SESSIONS, Integer.class, name);
        if (sessions != null && sessions > 0) {
            throw new RoleRemovalBlockedException(name, sessions + " active session(s)");
        }
        try {
            jdbc.execute("DROP ROLE " + quote(name));
        } catch (DataAccessException e) {
            if (SqlStates.isRemovalBlocked(e)) {
                throw new RoleRemovalBlockedException(name, e.getMostSpecificCause().getMessage(), e);
            }
            throw e;
        }
    }

    static final RowMapper<DatabaseRole> ROLE_MAPPER = new RoleRowMapper();

    static final class RoleRowMapper implements RowMapper<DatabaseRole> {

        @Override
        public DatabaseRole mapRow(ResultSet rs, int rowNum) throws SQLException {
            Set<String> memberOf = new LinkedHashSet<>();
            Array array = rs.getArray("member_of");
            if (array != null) {
                try {
                    for (Object group : (Object[]) array.getArray()) {
                        memberOf.add((String) group);
                    }
                } finally {
                    array.free();
                }
            }
            return DatabaseRole.fromMarker(
                    rs.getString("rolname"), rs.getString("marker"), rs.getBoolean("rolcanlogin"), memberOf);
        }
    }
}
