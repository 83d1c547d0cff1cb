package com.rolebridge.service.health;

import com.rolebridge.sync.ConflictRegistry;
import com.rolebridge.sync.IdentitySynchronizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports identity synchronization state on {@code /actuator/health}.
 *
 * <p>Naming conflicts need an operator and turn the component {@code DEGRADED}. Pending events are
 * retried automatically, so they only show up as detail.
 */
@Component("roleSync")
public class RoleSyncHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Identities need operator attention");

    private final IdentitySynchronizer synchronizer;

    public RoleSyncHealthIndicator(IdentitySynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Override
    public Health health() {
        List<ConflictRegistry.Conflict> conflicts = synchronizer.conflicts();
        Health.Builder builder = conflicts.isEmpty() ? Health.up() : Health.status(DEGRADED);
        builder.withDetail("pendingEvents", synchronizer.pendingCount())
                .withDetail("conflicts", conflicts.size());
        if (!conflicts.isEmpty()) {
            Map<String, String> flagged = new LinkedHashMap<>();
            for (ConflictRegistry.Conflict conflict : conflicts) {
                flagged.put(conflict.identityKey(), conflict.roleName() + ": " + conflict.reason());
            }
            builder.withDetail("conflictingIdentities", flagged);
        }
        return builder.build();
    }
}
