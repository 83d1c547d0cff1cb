package com.rolebridge.service.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Compact-constructor defaults of {@link RoleBridgeProperties}, checked without a Spring context. */
@DisplayName("RoleBridgeProperties")
class RoleBridgePropertiesTest {

    @Test
    @DisplayName("every section defaults when absent")
    void defaultsWhenAbsent() {
        var props = new RoleBridgeProperties(null, null, null, null);

        assertThat(props.naming().userPrefix()).isEqualTo("user_");
        assertThat(props.naming().groupPrefix()).isEqualTo("role_");
        assertThat(props.naming().reservedPatterns()).contains("^pg_.*", "^postgres$");
        assertThat(props.naming().maxLength()).isEqualTo(63);
        assertThat(props.sync().retryInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.sync().reconcileInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(props.context().allowNesting()).isTrue();
        assertThat(props.permissions().declarations()).isEmpty();
    }

    @Test
    @DisplayName("keeps explicit naming settings")
    void keepsExplicitNaming() {
        var naming = new RoleBridgeProperties.Naming("app_", "grp_", List.of("^admin$"), 40);

        assertThat(naming.userPrefix()).isEqualTo("app_");
        assertThat(naming.groupPrefix()).isEqualTo("grp_");
        assertThat(naming.reservedPatterns()).containsExactly("^admin$");
        assertThat(naming.maxLength()).isEqualTo(40);
    }

    @Test
    @DisplayName("blank prefixes and a non-positive max length fall back to defaults")
    void blankNamingFallsBack() {
        var naming = new RoleBridgeProperties.Naming(" ", "", null, -5);

        assertThat(naming.userPrefix()).isEqualTo("user_");
        assertThat(naming.groupPrefix()).isEqualTo("role_");
        assertThat(naming.maxLength()).isEqualTo(63);
    }

    @Test
    @DisplayName("zero or negative intervals fall back to defaults")
    void nonPositiveIntervalsFallBack() {
        var sync = new RoleBridgeProperties.Sync(Duration.ZERO, Duration.ofSeconds(-1));

        assertThat(sync.retryInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(sync.reconcileInterval()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("nesting can be switched off")
    void nestingCanBeDisabled() {
        assertThat(new RoleBridgeProperties.Context(false).allowNesting()).isFalse();
    }

    @Test
    @DisplayName("permission declarations keep entity order and are read-only")
    void declarationsKeepOrder() {
        Map<String, List<String>> declared = new LinkedHashMap<>();
        declared.put("books", List.of("GRANT SELECT ON books TO role_readers"));
        declared.put("authors", null);
        declared.put("loans", List.of("GRANT INSERT ON loans TO role_librarians"));

        var permissions = new RoleBridgeProperties.Permissions(declared);

        assertThat(permissions.declarations().keySet()).containsExactly("books", "authors", "loans");
        assertThat(permissions.declarations().get("authors")).isEmpty();
        assertThatThrownBy(() -> permissions.declarations().put("x", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
