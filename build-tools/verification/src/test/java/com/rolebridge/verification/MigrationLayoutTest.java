package com.rolebridge.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Flyway migrations in libs/database follow the versioned naming and numbering rules. */
@DisplayName("Migration layout")
class MigrationLayoutTest {

    private static final Pattern VERSIONED = Pattern.compile("V(\\d+)__[a-z0-9_]+\\.sql");

    private static Path migrations;

    @BeforeAll
    static void resolveMigrations() {
        Path projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        migrations = projectRoot.resolve("libs/database/src/main/resources/db/migration/rolebridge");
    }

    private static List<Path> sqlFiles() throws IOException {
        try (Stream<Path> files = Files.list(migrations)) {
            return files.filter(p -> p.toString().endsWith(".sql")).sorted().toList();
        }
    }

    @Test
    @DisplayName("the migration directory exists and is not empty")
    void directoryExists() throws IOException {
        assertThat(migrations).isDirectory();
        assertThat(sqlFiles()).isNotEmpty();
    }

    @Test
    @DisplayName("every file is a versioned migration")
    void versionedNames() throws IOException {
        assertThat(sqlFiles())
                .allSatisfy(p -> assertThat(p.getFileName().toString()).matches(VERSIONED));
    }

    @Test
    @DisplayName("versions run from 1 without gaps")
    void versionsAreContiguous() throws IOException {
        List<Integer> versions = sqlFiles().stream()
                .map(p -> VERSIONED.matcher(p.getFileName().toString()))
                .filter(m -> m.matches())
                .map(m -> Integer.parseInt(m.group(1)))
                .sorted()
                .toList();

        for (int i = 0; i < versions.size(); i++) {
            assertThat(versions.get(i)).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("the permission ledger and pending event tables are created")
    void coreTables() throws IOException {
        StringBuilder all = new StringBuilder();
        for (Path file : sqlFiles()) {
            all.append(Files.readString(file));
        }
        assertThat(all.toString())
                .contains("rolebridge_permission_ledger")
                .contains("rolebridge_pending_event");
    }
}
