package com.rolebridge.service.config;

import com.rolebridge.database.migration.JdbcPermissionDeclarationApplier;
import com.rolebridge.database.migration.PermissionDeclarationCallback;
import com.rolebridge.database.migration.PermissionDeclarationSource;
import com.rolebridge.database.role.PostgresRoleCatalog;
import com.rolebridge.database.session.HikariSessionPool;
import com.rolebridge.database.sync.JdbcPendingEventStore;
import com.rolebridge.security.PrefixRoleNamingPolicy;
import com.rolebridge.security.RoleNamingPolicy;
import com.rolebridge.security.context.SessionPool;
import com.rolebridge.security.role.RoleCatalog;
import com.rolebridge.sync.ConflictRegistry;
import com.rolebridge.sync.IdentitySynchronizer;
import com.rolebridge.sync.PendingEventStore;
import com.rolebridge.sync.SyncMetrics;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/** Wires the RoleBridge libraries onto Spring Boot's datasource, JDBC and metrics beans. */
@Configuration
@EnableConfigurationProperties(RoleBridgeProperties.class)
public class RoleBridgeConfig {

    @Bean
    public RoleNamingPolicy roleNamingPolicy(RoleBridgeProperties properties) {
        RoleBridgeProperties.Naming naming = properties.naming();
        return new PrefixRoleNamingPolicy(
                naming.userPrefix(),
                naming.groupPrefix(),
                naming.reservedPatterns(),
                naming.maxLength());
    }

    @Bean
    public RoleCatalog roleCatalog(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new PostgresRoleCatalog(jdbcTemplate, transactionTemplate);
    }

    @Bean
    public PendingEventStore pendingEventStore(JdbcTemplate jdbcTemplate) {
        return new JdbcPendingEventStore(jdbcTemplate);
    }

    @Bean
    public ConflictRegistry conflictRegistry() {
        return new ConflictRegistry();
    }

    @Bean
    public SyncMetrics syncMetrics(
            MeterRegistry meterRegistry,
            @Value("${spring.application.name:rolebridge-service}") String serviceName) {
        return new SyncMetrics(meterRegistry, serviceName);
    }

    @Bean
    public IdentitySynchronizer identitySynchronizer(
            RoleCatalog roleCatalog,
            RoleNamingPolicy roleNamingPolicy,
            PendingEventStore pendingEventStore,
            ConflictRegistry conflictRegistry,
            SyncMetrics syncMetrics) {
        return new IdentitySynchronizer(
                roleCatalog, roleNamingPolicy, pendingEventStore, conflictRegistry, syncMetrics);
    }

    @Bean
    public SessionPool sessionPool(HikariDataSource dataSource, RoleBridgeProperties properties) {
        return new HikariSessionPool(dataSource, properties.context().allowNesting());
    }

    @Bean
    public PermissionDeclarationSource permissionDeclarationSource(RoleBridgeProperties properties) {
        return () -> properties.permissions().declarations();
    }

    /**
     * Flyway auto-configuration registers every {@code Callback} bean with the migration run. JDBC
     * beans depend on Flyway, so the callback works on Flyway's own connection instead.
     */
    @Bean
    public PermissionDeclarationCallback permissionDeclarationCallback(
            PermissionDeclarationSource permissionDeclarationSource) {
        return new PermissionDeclarationCallback(
                permissionDeclarationSource, JdbcPermissionDeclarationApplier::forConnection);
    }
}
