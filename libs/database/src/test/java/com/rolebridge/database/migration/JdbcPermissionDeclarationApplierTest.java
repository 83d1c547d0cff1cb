package com.rolebridge.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcPermissionDeclarationApplier")
class JdbcPermissionDeclarationApplierTest {

    private static final String GRANT = "GRANT SELECT ON documents TO role_librarians";
    private static final String ENABLE = "ALTER TABLE documents ENABLE ROW LEVEL SECURITY";
    private static final String POLICY =
            "CREATE POLICY documents_owner ON documents USING (owner = current_user)";

    @Mock
    private JdbcTemplate jdbc;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcPermissionDeclarationApplier applier;

    @BeforeEach
    void setUp() {
        applier = new JdbcPermissionDeclarationApplier(jdbc, new TransactionTemplate(transactionManager));
    }

    @Test
    @DisplayName("runs new statements in order under a reset role and an entity lock, and records them")
    void appliesInOrder() {
        when(jdbc.queryForList(JdbcPermissionDeclarationApplier.APPLIED_HASHES, String.class, "documents"))
                .thenReturn(List.of());

        PermissionApplyResult result = applier.apply("documents", List.of(GRANT, ENABLE, POLICY));

        assertThat(result).isEqualTo(new PermissionApplyResult("documents", 3, 0));
        InOrder order = inOrder(jdbc, transactionManager);
        order.verify(jdbc).execute("RESET ROLE");
        order.verify(jdbc).query(eq(JdbcPermissionDeclarationApplier.LOCK),
                ArgumentMatchers.<ResultSetExtractor<Void>>any(), eq("rolebridge:permissions:documents"));
        order.verify(jdbc).execute(GRANT);
        order.verify(jdbc).update(JdbcPermissionDeclarationApplier.RECORD, "documents",
                JdbcPermissionDeclarationApplier.sha256(GRANT), 0, GRANT);
        order.verify(jdbc).execute(ENABLE);
        order.verify(jdbc).execute(POLICY);
        order.verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("skips statements already in the ledger")
    void skipsApplied() {
        when(jdbc.queryForList(JdbcPermissionDeclarationApplier.APPLIED_HASHES, String.class, "documents"))
                .thenReturn(List.of(JdbcPermissionDeclarationApplier.sha256(GRANT),
                        JdbcPermissionDeclarationApplier.sha256(ENABLE)));

        PermissionApplyResult result = applier.apply("documents", List.of(GRANT, "  " + ENABLE + "\n", POLICY));

        assertThat(result.applied()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(2);
        verify(jdbc, never()).execute(GRANT);
        verify(jdbc, never()).execute(ENABLE);
        verify(jdbc).execute(POLICY);
    }

    @Test
    @DisplayName("a failing statement rolls back the whole batch")
    void rollsBack() {
        when(jdbc.queryForList(JdbcPermissionDeclarationApplier.APPLIED_HASHES, String.class, "documents"))
                .thenReturn(List.of());
        lenient().doThrow(new BadSqlGrammarException("apply", ENABLE, new SQLException("syntax error", "42601")))
                .when(jdbc).execute(ENABLE);

        assertThatThrownBy(() -> applier.apply("documents", List.of(GRANT, ENABLE, POLICY)))
                .isInstanceOfSatisfying(PermissionApplyException.class, e -> {
                    assertThat(e.entityName()).isEqualTo("documents");
                    assertThat(e.statementIndex()).isEqualTo(1);
                });

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(jdbc, never()).execute(POLICY);
    }

    @Test
    @DisplayName("nothing to apply means no transaction at all")
    void emptyDeclaration() {
        assertThat(applier.apply("documents", List.of()).isNoop()).isTrue();

        verifyNoInteractions(jdbc, transactionManager);
    }

    @Test
    @DisplayName("a statement repeated in one declaration runs once")
    void duplicateInDeclaration() {
        when(jdbc.queryForList(JdbcPermissionDeclarationApplier.APPLIED_HASHES, String.class, "documents"))
                .thenReturn(List.of());

        PermissionApplyResult result = applier.apply("documents", List.of(GRANT, GRANT));

        assertThat(result).isEqualTo(new PermissionApplyResult("documents", 1, 1));
        verify(jdbc).update(anyString(), eq("documents"), anyString(), eq(0), eq(GRANT));
    }

    @Test
    @DisplayName("forConnection works on the given connection in one transaction and leaves it open")
    void forConnection() throws SQLException {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        PreparedStatement prepared = mock(PreparedStatement.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement(anyString())).thenReturn(prepared);
        when(prepared.executeQuery()).thenReturn(mock(ResultSet.class));

        PermissionApplyResult result =
                JdbcPermissionDeclarationApplier.forConnection(connection).apply("documents", List.of(GRANT));

        assertThat(result).isEqualTo(new PermissionApplyResult("documents", 1, 0));
        InOrder order = inOrder(statement, connection);
        order.verify(statement).execute("RESET ROLE");
        order.verify(statement).execute(GRANT);
        order.verify(connection).commit();
        verify(connection, never()).close();
    }
}
