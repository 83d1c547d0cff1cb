package com.rolebridge.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Migration SQL files must be on the classpath where Flyway looks for them.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    private static final String LOCATION = "db/migration/rolebridge/";

    @Test
    @DisplayName("V1 creates the permission ledger")
    void permissionLedger() throws IOException {
        String sql = readClasspathResource(LOCATION + "V1__permission_ledger.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE rolebridge_permission_ledger");
        assertThat(sql).contains("statement_hash").contains("PRIMARY KEY (entity_name, statement_hash)");
    }

    @Test
    @DisplayName("V2 creates the pending identity-event table keyed by event id")
    void pendingEvents() throws IOException {
        String sql = readClasspathResource(LOCATION + "V2__pending_identity_events.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE rolebridge_pending_event");
        assertThat(sql).contains("event_id        VARCHAR(64)  PRIMARY KEY");
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as(path + " must be on the classpath").isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
