package com.rolebridge.sync;

import com.rolebridge.identity.IdentityEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for identity synchronization. Every meter carries a {@code service} tag.
 */
public final class SyncMetrics {

    public static final String EVENTS = "rolebridge.sync.events";
    public static final String CONFLICTS = "rolebridge.sync.conflicts";
    public static final String PENDING = "rolebridge.sync.pending";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TYPE = "type";
    public static final String TAG_STATUS = "status";

    private final MeterRegistry registry;
    private final String serviceName;
    private final AtomicLong pending = new AtomicLong();

    public SyncMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        Gauge.builder(PENDING, pending, AtomicLong::doubleValue)
                .description("Identity events waiting to be retried")
                .tags(baseTags())
                .register(registry);
    }

    /** Metrics recorded into a private registry, for callers that do not export them. */
    public static SyncMetrics detached() {
        return new SyncMetrics(new SimpleMeterRegistry(), "rolebridge");
    }

    void recordOutcome(IdentityEventType type, SyncStatus status) {
        String typeTag = type == null ? "unknown" : type.value();
        Counter.builder(EVENTS)
                .description("Identity events synchronized, by type and outcome")
                .tags(baseTags(TAG_TYPE, typeTag, TAG_STATUS, status.value()))
                .register(registry)
                .increment();
    }

    void recordConflict() {
        Counter.builder(CONFLICTS)
                .description("Naming conflicts raised while synchronizing identities")
                .tags(baseTags())
                .register(registry)
                .increment();
    }

    void pendingEvents(int size) {
        pending.set(size);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
