package com.rolebridge.service.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.rolebridge.identity.ApplicationUser;
import com.rolebridge.identity.IdentityEventFactory;
import com.rolebridge.identity.IdentityKind;
import com.rolebridge.security.PrefixRoleNamingPolicy;
import com.rolebridge.security.testing.InMemoryRoleCatalog;
import com.rolebridge.sync.ConflictRegistry;
import com.rolebridge.sync.IdentitySynchronizer;
import com.rolebridge.sync.SyncMetrics;
import com.rolebridge.sync.testing.InMemoryPendingEventStore;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("RoleSyncHealthIndicator")
class RoleSyncHealthIndicatorTest {

    private InMemoryRoleCatalog catalog;
    private IdentitySynchronizer synchronizer;
    private RoleSyncHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryRoleCatalog();
        synchronizer = new IdentitySynchronizer(
                catalog,
                PrefixRoleNamingPolicy.defaults(),
                new InMemoryPendingEventStore(),
                new ConflictRegistry(),
                SyncMetrics.detached());
        indicator = new RoleSyncHealthIndicator(synchronizer);
    }

    @Test
    @DisplayName("UP with no conflicts and an empty queue")
    void upWhenIdle() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("pendingEvents", 0)
                .containsEntry("conflicts", 0)
                .doesNotContainKey("conflictingIdentities");
    }

    @Test
    @DisplayName("pending work is reported without degrading")
    void pendingStaysUp() {
        synchronizer.handle(IdentityEventFactory.userCreated(ApplicationUser.active("u1", "smith")));
        catalog.setActiveSessions("user_smith", 1);
        synchronizer.handle(IdentityEventFactory.deleted(IdentityKind.USER, "u1", "smith"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("pendingEvents", 1);
    }

    @Test
    @DisplayName("DEGRADED while a naming conflict is flagged")
    void degradedOnConflict() {
        catalog.addUnmanagedRole("user_smith", false);
        synchronizer.handle(IdentityEventFactory.userCreated(ApplicationUser.active("u1", "smith")));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(RoleSyncHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry("conflicts", 1);
        @SuppressWarnings("unchecked")
        Map<String, String> flagged = (Map<String, String>) health.getDetails().get("conflictingIdentities");
        assertThat(flagged).containsOnlyKeys("user:u1");
        assertThat(flagged.get("user:u1")).startsWith("user_smith: ");
    }
}
