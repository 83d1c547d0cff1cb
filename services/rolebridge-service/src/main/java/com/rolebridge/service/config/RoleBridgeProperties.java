package com.rolebridge.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the RoleBridge service, bound from the {@code rolebridge.*} prefix.
 *
 * <pre>
 * rolebridge:
 *   naming:
 *     user-prefix: user_
 *     group-prefix: role_
 *     reserved-patterns: ["^pg_.*", "^postgres$"]
 *     max-length: 63
 *   sync:
 *     retry-interval: PT30S
 *     reconcile-interval: PT15M
 *   context:
 *     allow-nesting: true
 *   permissions:
 *     declarations:
 *       books:
 *         - GRANT SELECT ON books TO role_readers
 * </pre>
 *
 * <p>Every section is optional; compact constructors fill in defaults before Bean Validation runs.
 */
@ConfigurationProperties(prefix = "rolebridge")
@Validated
public record RoleBridgeProperties(
        @Valid Naming naming, @Valid Sync sync, @Valid Context context, @Valid Permissions permissions) {

    public RoleBridgeProperties {
        if (naming == null) {
            naming = new Naming(null, null, null, 0);
        }
        if (sync == null) {
            sync = new Sync(null, null);
        }
        if (context == null) {
            context = new Context(null);
        }
        if (permissions == null) {
            permissions = new Permissions(null);
        }
    }

    /**
     * Role naming policy settings.
     *
     * @param userPrefix prefix of roles derived from users
     * @param groupPrefix prefix of roles derived from groups
     * @param reservedPatterns regular expressions of names the policy must never produce
     * @param maxLength longest role name the database accepts
     */
    public record Naming(
            @NotBlank String userPrefix,
            @NotBlank String groupPrefix,
            @NotNull List<String> reservedPatterns,
            @Positive int maxLength) {

        public Naming {
            if (userPrefix == null || userPrefix.isBlank()) {
                userPrefix = "user_";
            }
            if (groupPrefix == null || groupPrefix.isBlank()) {
                groupPrefix = "role_";
            }
            reservedPatterns =
                    reservedPatterns == null
                            ? List.of("^pg_.*", "^postgres$", "^rolebridge_.*", "^public$")
                            : List.copyOf(reservedPatterns);
            if (maxLength <= 0) {
                maxLength = 63;
            }
        }
    }

    /**
     * Synchronization scheduling.
     *
     * @param retryInterval delay between passes over the pending queue
     * @param reconcileInterval delay between full reconciliation passes
     */
    public record Sync(@NotNull Duration retryInterval, @NotNull Duration reconcileInterval) {

        public Sync {
            if (retryInterval == null || retryInterval.isNegative() || retryInterval.isZero()) {
                retryInterval = Duration.ofSeconds(30);
            }
            if (reconcileInterval == null
                    || reconcileInterval.isNegative()
                    || reconcileInterval.isZero()) {
                reconcileInterval = Duration.ofMinutes(15);
            }
        }
    }

    /** @param allowNesting whether a privilege context may be entered inside another one */
    public record Context(Boolean allowNesting) {

        public Context {
            if (allowNesting == null) {
                allowNesting = Boolean.TRUE;
            }
        }
    }

    /** @param declarations permission statements per schema entity, applied in map order */
    public record Permissions(Map<String, List<String>> declarations) {

        public Permissions {
            if (declarations == null) {
                declarations = Map.of();
            } else {
                Map<String, List<String>> ordered = new LinkedHashMap<>();
                declarations.forEach(
                        (entity, statements) ->
                                ordered.put(
                                        entity,
                                        statements == null ? List.of() : List.copyOf(statements)));
                declarations = Collections.unmodifiableMap(ordered);
            }
        }
    }
}
