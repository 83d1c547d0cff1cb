package com.rolebridge.database.migration;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.flywaydb.core.api.callback.Callback;
import org.flywaydb.core.api.callback.Context;
import org.flywaydb.core.api.callback.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flyway callback that applies every declared permission after a successful {@code migrate}.
 *
 * <p>Register it on the Flyway configuration ({@code Flyway.configure().callbacks(...)}), or as a
 * bean when Spring Boot configures Flyway. The applier is built per run on the connection Flyway
 * hands to the callback, so the callback needs no JDBC beans of its own; those are initialized only
 * after Flyway. Runs outside Flyway's migration transaction; each entity gets its own transaction
 * in the applier.
 */
public class PermissionDeclarationCallback implements Callback {

    private static final Logger log = LoggerFactory.getLogger(PermissionDeclarationCallback.class);

    private final PermissionDeclarationSource source;
    private final Function<Connection, ? extends PermissionDeclarationApplier> applierFactory;

    /**
     * @param source declared statements per entity
     * @param applierFactory builds the applier on Flyway's connection, e.g.
     *     {@code JdbcPermissionDeclarationApplier::forConnection}
     */
    public PermissionDeclarationCallback(
            PermissionDeclarationSource source,
            Function<Connection, ? extends PermissionDeclarationApplier> applierFactory) {
        if (source == null || applierFactory == null) {
            throw new IllegalArgumentException("source and applierFactory are required");
        }
        this.source = source;
        this.applierFactory = applierFactory;
    }

    @Override
    public boolean supports(Event event, Context context) {
        return event == Event.AFTER_MIGRATE;
    }

    @Override
    public boolean canHandleInTransaction(Event event, Context context) {
        return false;
    }

    @Override
    public void handle(Event event, Context context) {
        Map<String, List<String>> declarations = source.declarations();
        if (declarations.isEmpty()) {
            return;
        }
        PermissionDeclarationApplier applier = applierFactory.apply(context.getConnection());
        int applied = 0;
        for (Map.Entry<String, List<String>> entry : declarations.entrySet()) {
            applied += applier.apply(entry.getKey(), entry.getValue()).applied();
        }
        log.info("Permission declarations checked for {} entities, {} statement(s) applied",
                declarations.size(), applied);
    }

    @Override
    public String getCallbackName() {
        return "rolebridge-permission-declarations";
    }
}
