package com.rolebridge.database.migration;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link PermissionDeclarationApplier} recording applied statements in
 * {@code rolebridge_permission_ledger} (migration V1).
 *
 * <p>A statement is identified by the SHA-256 of its trimmed text. Per entity, one run:
 *
 * <ol>
 *   <li>resets the session role so statements run with the connection's own privileges,
 *   <li>takes a transaction-scoped advisory lock on the entity so concurrent migrators queue up,
 *   <li>executes every statement whose hash is not in the ledger and records it.
 * </ol>
 *
 * <p>All of it happens in a single transaction.
 */
public class JdbcPermissionDeclarationApplier implements PermissionDeclarationApplier {

    private static final Logger log = LoggerFactory.getLogger(JdbcPermissionDeclarationApplier.class);

    static final String LOCK = "SELECT pg_advisory_xact_lock(hashtext(?))";

    static final String APPLIED_HASHES =
            "SELECT statement_hash FROM rolebridge_permission_ledger WHERE entity_name = ?";

    static final String RECORD = "INSERT INTO rolebridge_permission_ledger"
            + " (entity_name, statement_hash, statement_index, statement) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcPermissionDeclarationApplier(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    /**
     * Creates an applier that runs on {@code connection} and leaves it open, for use inside a
     * Flyway callback.
     */
    public static JdbcPermissionDeclarationApplier forConnection(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
        return new JdbcPermissionDeclarationApplier(
                new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Override
    public PermissionApplyResult apply(String entityName, List<String> statements) {
        if (entityName == null || entityName.isBlank()) {
            throw new IllegalArgumentException("entityName must not be null or blank");
        }
        if (statements == null || statements.isEmpty()) {
            return new PermissionApplyResult(entityName, 0, 0);
        }
        PermissionApplyResult result = transactions.execute(status -> applyInTransaction(entityName, statements));
        if (result.isNoop()) {
            log.debug("Permission declarations for {} already applied ({} statement(s))",
                    entityName, result.skipped());
        } else {
            log.info("Applied {} permission statement(s) for {} ({} already applied)",
                    result.applied(), entityName, result.skipped());
        }
        return result;
    }

    private PermissionApplyResult applyInTransaction(String entityName, List<String> statements) {
        jdbc.execute("RESET ROLE");
        jdbc.query(LOCK, (ResultSetExtractor<Void>) rs -> null, "rolebridge:permissions:" + entityName);
        Set<String> applied = new HashSet<>(jdbc.queryForList(APPLIED_HASHES, String.class, entityName));

        int executed = 0;
        int skipped = 0;
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i).strip();
            String hash = sha256(statement);
            if (!applied.add(hash)) {
                skipped++;
                continue;
            }
            try {
                jdbc.execute(statement);
            } catch (DataAccessException e) {
                throw new PermissionApplyException(entityName, i, statement, e);
            }
            jdbc.update(RECORD, entityName, hash, i, statement);
            executed++;
        }
        return new PermissionApplyResult(entityName, executed, skipped);
    }

    static String sha256(String statement) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(statement.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
