package com.rolebridge.database.role;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rolebridge.security.role.DatabaseRole;
import com.rolebridge.security.role.RoleKind;
import com.rolebridge.security.role.RoleRemovalBlockedException;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@DisplayName("PostgresRoleCatalog")
class PostgresRoleCatalogTest {

    @Mock
    private JdbcTemplate jdbc;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PostgresRoleCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new PostgresRoleCatalog(jdbc, new TransactionTemplate(transactionManager));
    }

    private static UncategorizedSQLException sqlFailure(String sqlState) {
        return new UncategorizedSQLException("role ddl", "DDL", new SQLException("failed", sqlState));
    }

    @Nested
    @DisplayName("createRole")
    class CreateRole {

        @Test
        @DisplayName("creates the role and writes its marker in one transaction")
        void createsWithMarker() {
            catalog.createRole("user_smith", RoleKind.USER_ROLE, "u1", true);

            InOrder order = inOrder(jdbc, transactionManager);
            order.verify(jdbc).execute("CREATE ROLE \"user_smith\" LOGIN");
            order.verify(jdbc).execute("COMMENT ON ROLE \"user_smith\" IS 'rolebridge:user:u1'");
            order.verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("group roles cannot log in")
        void groupRole() {
            catalog.createRole("role_librarians", RoleKind.GROUP_ROLE, "g1", false);

            verify(jdbc).execute("CREATE ROLE \"role_librarians\" NOLOGIN");
            verify(jdbc).execute("COMMENT ON ROLE \"role_librarians\" IS 'rolebridge:group:g1'");
        }

        @Test
        @DisplayName("an existing role is reported as IllegalStateException and rolled back")
        void duplicate() {
            doThrow(sqlFailure("42710")).when(jdbc).execute("CREATE ROLE \"user_smith\" LOGIN");

            assertThatThrownBy(() -> catalog.createRole("user_smith", RoleKind.USER_ROLE, "u1", true))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already exists");

            verify(transactionManager).rollback(any());
            verify(jdbc, never()).execute("COMMENT ON ROLE \"user_smith\" IS 'rolebridge:user:u1'");
        }
    }

    @Nested
    @DisplayName("role mutations")
    class Mutations {

        @Test
        @DisplayName("renames in place")
        void rename() {
            catalog.renameRole("user_smith", "user_smithjr");

            verify(jdbc).execute("ALTER ROLE \"user_smith\" RENAME TO \"user_smithjr\"");
        }

        @Test
        @DisplayName("toggles login")
        void login() {
            catalog.setLogin("user_smith", false);

            verify(jdbc).execute("ALTER ROLE \"user_smith\" NOLOGIN");
        }

        @Test
        @DisplayName("grants and revokes membership")
        void membership() {
            catalog.grantMembership("role_librarians", "user_smith");
            catalog.revokeMembership("role_librarians", "user_smith");

            verify(jdbc).execute("GRANT \"role_librarians\" TO \"user_smith\"");
            verify(jdbc).execute("REVOKE \"role_librarians\" FROM \"user_smith\"");
        }
    }

    @Nested
    @DisplayName("dropRole")
    class DropRole {

        @Test
        @DisplayName("drops a role nobody is using")
        void drops() {
            when(jdbc.queryForObject(PostgresRoleCatalog.ACTIVE_SESSIONS, Integer.class, "user_smith"))
                    .thenReturn(0);

            catalog.dropRole("user_smith");

            verify(jdbc).execute("DROP ROLE \"user_smith\"");
        }

        @Test
        @DisplayName("active sessions block removal before DROP is attempted")
        void activeSessions() {
            when(jdbc.queryForObject(PostgresRoleCatalog.ACTIVE_SESSIONS, Integer.class, "user_smith"))
                    .thenReturn(2);

            assertThatThrownBy(() -> catalog.dropRole("user_smith"))
                    .isInstanceOfSatisfying(RoleRemovalBlockedException.class,
                            e -> assertThat(e.roleName()).isEqualTo("user_smith"))
                    .hasMessageContaining("2 active session(s)");
            verify(jdbc, never()).execute(anyString());
        }

        @Test
        @DisplayName("owned objects block removal")
        void dependentObjects() {
            when(jdbc.queryForObject(PostgresRoleCatalog.ACTIVE_SESSIONS, Integer.class, "user_smith"))
                    .thenReturn(0);
            doThrow(sqlFailure("2BP01")).when(jdbc).execute("DROP ROLE \"user_smith\"");

            assertThatThrownBy(() -> catalog.dropRole("user_smith"))
                    .isInstanceOf(RoleRemovalBlockedException.class)
                    .hasCauseInstanceOf(DataAccessException.class);
        }

        @Test
        @DisplayName("other failures propagate unchanged")
        void otherFailure() {
            when(jdbc.queryForObject(PostgresRoleCatalog.ACTIVE_SESSIONS, Integer.class, "user_smith"))
                    .thenReturn(0);
            doThrow(sqlFailure("42501")).when(jdbc).execute("DROP ROLE \"user_smith\"");

            assertThatThrownBy(() -> catalog.dropRole("user_smith"))
                    .isInstanceOf(UncategorizedSQLException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("finds a managed role by its marker")
        void findByMarker() {
            DatabaseRole librarians = new DatabaseRole("role_librarians", RoleKind.GROUP_ROLE, "g1", false, Set.of());
            when(jdbc.query(eq(PostgresRoleCatalog.FIND_BY_MARKER),
                    ArgumentMatchers.<RowMapper<DatabaseRole>>any(), eq("rolebridge:group:g1")))
                    .thenReturn(List.of(librarians));

            assertThat(catalog.findManagedRole(RoleKind.GROUP_ROLE, "g1")).contains(librarians);
        }

        @Test
        @DisplayName("lists direct members")
        void members() {
            when(jdbc.queryForList(PostgresRoleCatalog.MEMBERS_OF, String.class, "role_librarians"))
                    .thenReturn(List.of("user_jones", "user_smith"));

            assertThat(catalog.membersOf("role_librarians")).containsExactly("user_jones", "user_smith");
        }

        @Test
        @DisplayName("maps a row with a marker to a managed role")
        void mapsManagedRow() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            Array groups = mock(Array.class);
            when(rs.getString("rolname")).thenReturn("user_smith");
            when(rs.getString("marker")).thenReturn("rolebridge:user:u1");
            when(rs.getBoolean("rolcanlogin")).thenReturn(true);
            when(rs.getArray("member_of")).thenReturn(groups);
            when(groups.getArray()).thenReturn(new String[] {"reporting", "role_librarians"});

            DatabaseRole role = PostgresRoleCatalog.ROLE_MAPPER.mapRow(rs, 0);

            assertThat(role).isEqualTo(new DatabaseRole(
                    "user_smith", RoleKind.USER_ROLE, "u1", true, Set.of("reporting", "role_librarians")));
            verify(groups).free();
        }

        @Test
        @DisplayName("maps a row without a marker to an unmanaged role")
        void mapsUnmanagedRow() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            when(rs.getString("rolname")).thenReturn("postgres");
            when(rs.getString("marker")).thenReturn(null);
            when(rs.getBoolean("rolcanlogin")).thenReturn(true);

            DatabaseRole role = PostgresRoleCatalog.ROLE_MAPPER.mapRow(rs, 0);

            assertThat(role.kind()).isEqualTo(RoleKind.UNMANAGED);
            assertThat(role.identityId()).isNull();
            assertThat(role.memberOf()).isEmpty();
        }
    }
}
