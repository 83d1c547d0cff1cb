package com.rolebridge.sync;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identities left unsynchronized because of a naming conflict.
 *
 * <p>An entry stays until the same identity synchronizes cleanly, at which point it is cleared.
 */
public final class ConflictRegistry {

    /**
     * One flagged identity.
     *
     * @param identityKey per-identity key, e.g. {@code user:42}
     * @param identifier the identity's name at the time of the conflict
     * @param roleName the role name that could not be used
     * @param reason conflict detail
     * @param detectedAt when the conflict was last seen
     */
    public record Conflict(
            String identityKey, String identifier, String roleName, String reason, Instant detectedAt) {}

    private final Map<String, Conflict> conflicts = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConflictRegistry() {
        this(Clock.systemUTC());
    }

    public ConflictRegistry(Clock clock) {
        this.clock = clock;
    }

    void flag(String identityKey, String identifier, String roleName, String reason) {
        conflicts.put(identityKey,
                new Conflict(identityKey, identifier, roleName, reason, Instant.now(clock)));
    }

    boolean clear(String identityKey) {
        return conflicts.remove(identityKey) != null;
    }

    /** Current conflicts, sorted by identity key. */
    public List<Conflict> conflicts() {
        return conflicts.values().stream()
                .sorted(Comparator.comparing(Conflict::identityKey))
                .toList();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
