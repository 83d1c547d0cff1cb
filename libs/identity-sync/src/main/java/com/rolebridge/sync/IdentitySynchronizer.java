package com.rolebridge.sync;

import com.rolebridge.identity.ApplicationGroup;
import com.rolebridge.identity.ApplicationUser;
import com.rolebridge.identity.IdentityEvent;
import com.rolebridge.identity.IdentityEventFactory;
import com.rolebridge.identity.IdentityEventType;
import com.rolebridge.identity.IdentityEventValidator;
import com.rolebridge.identity.IdentityKind;
import com.rolebridge.identity.ValidationResult;
import com.rolebridge.security.NamingConflictException;
import com.rolebridge.security.RoleNamingPolicy;
import com.rolebridge.security.role.DatabaseRole;
import com.rolebridge.security.role.RoleCatalog;
import com.rolebridge.security.role.RoleKind;
import com.rolebridge.security.role.RoleRemovalBlockedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps database roles consistent with application users and groups.
 *
 * <p>Every operation is an upsert against the current role catalog, so replaying an event, or a
 * whole sequence of events, leaves the catalog exactly as a single delivery would. Roles are found
 * by the marker carrying the identity's stable id, never by name alone; roles without a marker are
 * never altered, granted to, or dropped. Group members are user ids, resolved through the same
 * markers, so a membership survives a rename of the member.
 *
 * <p>Only a rename (or reconciliation) changes the name of an existing role. Renames and login
 * changes are applied in {@code occurredAt} order per identity: once one has applied, older ones of
 * the same kind are dropped from the queue and skipped on redelivery.
 *
 * <p>Events for the same identity are serialized; events for different identities run
 * concurrently. A failure on one identity is reported in its {@link SyncOutcome} and never thrown,
 * so it cannot hold up any other identity. Work that cannot finish yet (blocked removals, members
 * whose roles do not exist yet, database errors) is put in the {@link PendingEventStore} and
 * replayed by {@link #retryPending()}.
 */
public final class IdentitySynchronizer {

    private static final Logger log = LoggerFactory.getLogger(IdentitySynchronizer.class);

    private final RoleCatalog catalog;
    private final RoleNamingPolicy naming;
    private final PendingEventStore pendingStore;
    private final ConflictRegistry conflicts;
    private final SyncMetrics metrics;
    private final IdentityLockRegistry locks = new IdentityLockRegistry();
    private final Map<String, Instant> lastApplied = new ConcurrentHashMap<>();

    public IdentitySynchronizer(
            RoleCatalog catalog,
            RoleNamingPolicy naming,
            PendingEventStore pendingStore,
            ConflictRegistry conflicts,
            SyncMetrics metrics) {
        if (catalog == null || naming == null || pendingStore == null || conflicts == null
                || metrics == null) {
            throw new IllegalArgumentException("all collaborators are required");
        }
        this.catalog = catalog;
        this.naming = naming;
        this.pendingStore = pendingStore;
        this.conflicts = conflicts;
        this.metrics = metrics;
    }

    /**
     * Synchronizes one identity lifecycle event.
     *
     * @return the outcome; never throws for per-identity failures
     * @throws IllegalArgumentException if {@code event} is null
     */
    public SyncOutcome handle(IdentityEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        ValidationResult validation = IdentityEventValidator.validate(event);
        if (!validation.valid()) {
            return reject(event, validation);
        }
        return locks.withLock(event.identityKey(), () -> {
            SyncLogContext.set(event);
            try {
                if (isOutdated(event)) {
                    log.info("Skipping {} for {}: a later change already applied", event.type(), event.identityKey());
                    return settle(event, Step.of(SyncStatus.UNCHANGED,
                            "superseded by a later " + orderingAspect(event.type()) + " change"));
                }
                Step step = process(event);
                if (step.status().isSettled()) {
                    markApplied(event);
                }
                return settle(event, step);
            } finally {
                SyncLogContext.clear();
            }
        });
    }

    /**
     * Replays every queued event once, oldest first. Events that settle leave the queue; the rest
     * stay with their attempt count raised.
     */
    public List<SyncOutcome> retryPending() {
        List<PendingEvent> snapshot = pendingStore.pending();
        if (snapshot.isEmpty()) {
            return List.of();
        }
        log.debug("Retrying {} pending identity event(s)", snapshot.size());
        List<SyncOutcome> outcomes = new ArrayList<>();
        for (PendingEvent pending : snapshot) {
            if (stillQueued(pending)) {
                outcomes.add(handle(pending.event()));
            }
        }
        return outcomes;
    }

    /**
     * Converges the catalog to a full snapshot of the identity store: every user and group gets
     * its role with the right name and login flag, group memberships are set exactly, and managed
     * roles whose identity is gone are removed.
     */
    public ReconciliationReport reconcile(
            Collection<ApplicationUser> users, Collection<ApplicationGroup> groups) {
        SyncTally tally = new SyncTally();
        Set<String> userIds = new HashSet<>();
        Set<String> groupIds = new HashSet<>();

        for (ApplicationUser user : users) {
            userIds.add(user.id());
            reconcileIdentity(IdentityKind.USER, user.id(), tally, () -> {
                DatabaseRole role = ensureRole(IdentityKind.USER, user.id(), user.name(), true, user.active(), tally);
                setLogin(role, user.active(), tally);
            });
        }
        for (ApplicationGroup group : groups) {
            groupIds.add(group.id());
            reconcileIdentity(IdentityKind.GROUP, group.id(), tally, () -> {
                DatabaseRole role = ensureRole(IdentityKind.GROUP, group.id(), group.name(), true, false, tally);
                reconcileMembers(role.name(), group.memberIds(), tally);
            });
        }
        for (DatabaseRole role : catalog.managedRoles()) {
            boolean orphan = role.kind() == RoleKind.USER_ROLE
                    ? !userIds.contains(role.identityId())
                    : !groupIds.contains(role.identityId());
            if (orphan) {
                IdentityKind kind = identityKind(role.kind());
                reconcileIdentity(kind, role.identityId(), tally, () -> removeOrphan(kind, role, tally));
            }
        }

        metrics.pendingEvents(pendingStore.size());
        ReconciliationReport report = tally.toReport();
        log.info("Reconciliation finished: {}", report);
        return report;
    }

    /** Identities currently flagged with a naming conflict. */
    public List<ConflictRegistry.Conflict> conflicts() {
        return conflicts.conflicts();
    }

    /** Number of events waiting to be retried. */
    public int pendingCount() {
        return pendingStore.size();
    }

    private SyncOutcome reject(IdentityEvent event, ValidationResult validation) {
        String message = String.join("; ", validation.errors());
        String key = event.kind() != null && event.identityId() != null ? event.identityKey() : null;
        log.warn("Rejected identity event {}: {}", event.eventId(), message);
        if (event.eventId() != null && !event.eventId().isBlank()) {
            pendingStore.remove(event.eventId());
        }
        metrics.recordOutcome(event.type(), SyncStatus.REJECTED);
        return new SyncOutcome(event.eventId(), key, SyncStatus.REJECTED, message);
    }

    private Step process(IdentityEvent event) {
        SyncTally tally = new SyncTally();
        try {
            return switch (event.type()) {
                case CREATED -> created(event, tally);
                case RENAMED -> renamed(event, tally);
                case DEACTIVATED -> login(event, false, tally);
                case REACTIVATED -> login(event, true, tally);
                case DELETED -> deleted(event, tally);
                case MEMBERSHIP_CHANGED -> membershipChanged(event, tally);
            };
        } catch (NamingConflictException e) {
            flagConflict(event.identityKey(), e);
            return Step.of(SyncStatus.CONFLICT, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Synchronizing {} failed, queued for retry", event.identityKey(), e);
            return new Step(SyncStatus.FAILED, String.valueOf(e.getMessage()), event);
        }
    }

    private SyncOutcome settle(IdentityEvent event, Step step) {
        if (step.requeue() != null) {
            pendingStore.enqueue(step.requeue(), step.message());
            if (!step.requeue().eventId().equals(event.eventId())) {
                pendingStore.remove(event.eventId());
            }
        } else {
            pendingStore.remove(event.eventId());
        }
        if (step.status().isSettled() && conflicts.clear(event.identityKey())) {
            log.info("Naming conflict for {} resolved", event.identityKey());
        }
        metrics.recordOutcome(event.type(), step.status());
        metrics.pendingEvents(pendingStore.size());
        return new SyncOutcome(event.eventId(), event.identityKey(), step.status(), step.message());
    }

    private Step created(IdentityEvent event, SyncTally tally) {
        boolean revived = cancelPendingDeletion(event);
        boolean isUser = event.kind() == IdentityKind.USER;
        DatabaseRole role = ensureRole(event.kind(), event.identityId(), event.name(), false, isUser, tally);
        if (isUser && revived) {
            setLogin(role, true, tally);
        }
        if (!isUser && !event.addedMembers().isEmpty()) {
            return applyMembers(event, role.name(), event.addedMembers(), Set.of(), tally);
        }
        return Step.done(tally, "role " + role.name());
    }

    private Step renamed(IdentityEvent event, SyncTally tally) {
        DatabaseRole role = ensureRole(event.kind(), event.identityId(), event.name(), true,
                event.kind() == IdentityKind.USER, tally);
        return Step.done(tally, "role " + role.name());
    }

    private Step login(IdentityEvent event, boolean enabled, SyncTally tally) {
        DatabaseRole role = ensureRole(IdentityKind.USER, event.identityId(), event.name(), false, enabled, tally);
        setLogin(role, enabled, tally);
        return Step.done(tally, "role " + role.name() + (enabled ? " may log in" : " may not log in"));
    }

    private Step deleted(IdentityEvent event, SyncTally tally) {
        RoleKind roleKind = roleKind(event.kind());
        dropOtherPending(event);
        Optional<DatabaseRole> existing = catalog.findManagedRole(roleKind, event.identityId());
        if (existing.isEmpty()) {
            log.debug("No role left for deleted {}", event.identityKey());
            return Step.done(tally, "role already removed");
        }
        DatabaseRole role = existing.get();
        setLogin(role, false, tally);
        for (String group : role.memberOf()) {
            if (catalog.findRole(group).map(DatabaseRole::isManaged).orElse(false)) {
                catalog.revokeMembership(group, role.name());
                tally.membershipsRevoked++;
            }
        }
        if (roleKind == RoleKind.GROUP_ROLE) {
            for (String member : catalog.membersOf(role.name())) {
                if (isManagedUserRole(member)) {
                    catalog.revokeMembership(role.name(), member);
                    tally.membershipsRevoked++;
                }
            }
        }
        try {
            catalog.dropRole(role.name());
        } catch (RoleRemovalBlockedException e) {
            log.warn("Removal of role {} pending: {}", role.name(), e.getMessage());
            return new Step(SyncStatus.REMOVAL_PENDING, e.getMessage(), event);
        }
        tally.rolesRemoved++;
        log.info("Dropped role {}", role.name());
        return Step.done(tally, "role " + role.name() + " dropped");
    }

    private Step membershipChanged(IdentityEvent event, SyncTally tally) {
        DatabaseRole group = ensureRole(IdentityKind.GROUP, event.identityId(), event.name(), false, false, tally);
        supersedePendingMembers(event);
        return applyMembers(event, group.name(), event.addedMembers(), event.removedMembers(), tally);
    }

    private Step applyMembers(
            IdentityEvent event, String groupRole, Set<String> added, Set<String> removed, SyncTally tally) {
        Set<String> current = catalog.membersOf(groupRole);
        for (String member : removed) {
            Optional<String> memberRole = managedUserRole(member);
            if (memberRole.isPresent() && current.contains(memberRole.get())) {
                catalog.revokeMembership(groupRole, memberRole.get());
                tally.membershipsRevoked++;
                log.info("Revoked {} from {}", groupRole, memberRole.get());
            }
        }
        Set<String> missing = new TreeSet<>();
        for (String member : added) {
            Optional<String> memberRole = managedUserRole(member);
            if (memberRole.isEmpty()) {
                missing.add(member);
            } else if (!current.contains(memberRole.get())) {
                catalog.grantMembership(groupRole, memberRole.get());
                tally.membershipsGranted++;
                log.info("Granted {} to {}", groupRole, memberRole.get());
            }
        }
        if (missing.isEmpty()) {
            return Step.done(tally, "members of " + groupRole + " in sync");
        }
        log.warn("Members {} of {} have no role yet, deferred", missing, groupRole);
        return new Step(SyncStatus.DEFERRED, "waiting for member roles " + missing, deferredMembers(event, missing));
    }

    private IdentityEvent deferredMembers(IdentityEvent event, Set<String> missing) {
        if (event.type() != IdentityEventType.MEMBERSHIP_CHANGED) {
            return IdentityEventFactory.membershipChanged(
                    ApplicationGroup.empty(event.identityId(), event.name()), missing, Set.of());
        }
        if (missing.equals(event.addedMembers()) && event.removedMembers().isEmpty()) {
            return event;
        }
        return IdentityEventFactory.remainder(event, missing, Set.of());
    }

    /**
     * Returns the role of {@code identityId}, creating it from {@code name} when the identity has
     * none. An existing role is renamed to match {@code name} only when the name is authoritative;
     * otherwise the name carried by the event may be older than the role's.
     */
    private DatabaseRole ensureRole(
            IdentityKind kind,
            String identityId,
            String name,
            boolean authoritativeName,
            boolean loginIfCreated,
            SyncTally tally) {
        RoleKind roleKind = roleKind(kind);
        Optional<DatabaseRole> existing = catalog.findManagedRole(roleKind, identityId);
        if (existing.isPresent() && !authoritativeName) {
            return existing.get();
        }
        String desired = naming.roleName(roleKind, name);
        if (existing.isPresent()) {
            DatabaseRole role = existing.get();
            if (role.name().equals(desired)) {
                return role;
            }
            requireAvailable(desired, name);
            catalog.renameRole(role.name(), desired);
            tally.rolesRenamed++;
            log.info("Renamed role {} to {}", role.name(), desired);
            return new DatabaseRole(desired, roleKind, identityId, role.loginCapable(), role.memberOf());
        }
        requireAvailable(desired, name);
        catalog.createRole(desired, roleKind, identityId, loginIfCreated);
        tally.rolesCreated++;
        log.info("Created role {} ({})", desired, loginIfCreated ? "LOGIN" : "NOLOGIN");
        return new DatabaseRole(desired, roleKind, identityId, loginIfCreated, Set.of());
    }

    private void requireAvailable(String roleName, String identifier) {
        Optional<DatabaseRole> holder = catalog.findRole(roleName);
        if (holder.isPresent()) {
            DatabaseRole role = holder.get();
            String owner = role.isManaged()
                    ? "the role of " + role.kind().markerValue() + " " + role.identityId()
                    : "an unmanaged role";
            throw new NamingConflictException(identifier, roleName, "name is already held by " + owner);
        }
    }

    private void setLogin(DatabaseRole role, boolean enabled, SyncTally tally) {
        if (role.loginCapable() != enabled) {
            catalog.setLogin(role.name(), enabled);
            tally.loginChanges++;
            log.info("Set {} on role {}", enabled ? "LOGIN" : "NOLOGIN", role.name());
        }
    }

    private Optional<String> managedUserRole(String userId) {
        return catalog.findManagedRole(RoleKind.USER_ROLE, userId).map(DatabaseRole::name);
    }

    private boolean isManagedUserRole(String roleName) {
        return catalog.findRole(roleName)
                .map(r -> r.kind() == RoleKind.USER_ROLE)
                .orElse(false);
    }

    private void reconcileMembers(String groupRole, Set<String> memberIds, SyncTally tally) {
        Set<String> desired = new TreeSet<>();
        for (String member : memberIds) {
            Optional<String> memberRole = managedUserRole(member);
            if (memberRole.isPresent()) {
                desired.add(memberRole.get());
            } else {
                tally.membersMissing++;
                log.warn("Member {} of {} has no role, skipped", member, groupRole);
            }
        }
        Set<String> current = catalog.membersOf(groupRole);
        for (String memberRole : desired) {
            if (!current.contains(memberRole)) {
                catalog.grantMembership(groupRole, memberRole);
                tally.membershipsGranted++;
                log.info("Granted {} to {}", groupRole, memberRole);
            }
        }
        for (String memberRole : current) {
            if (isManagedUserRole(memberRole) && !desired.contains(memberRole)) {
                catalog.revokeMembership(groupRole, memberRole);
                tally.membershipsRevoked++;
                log.info("Revoked {} from {}", groupRole, memberRole);
            }
        }
    }

    private void removeOrphan(IdentityKind kind, DatabaseRole role, SyncTally tally) {
        String key = IdentityEvent.identityKey(kind, role.identityId());
        IdentityEvent deletion = pendingStore.pendingFor(key).stream()
                .map(PendingEvent::event)
                .filter(e -> e.type() == IdentityEventType.DELETED)
                .findFirst()
                .orElseGet(() -> IdentityEventFactory.deleted(kind, role.identityId(),
                        naming.identityOf(role.name())
                                .map(RoleNamingPolicy.RoleIdentity::identifier)
                                .orElse(role.name())));
        Step step = deleted(deletion, tally);
        if (step.status() == SyncStatus.REMOVAL_PENDING) {
            pendingStore.enqueue(deletion, step.message());
            tally.removalsPending++;
        } else {
            pendingStore.remove(deletion.eventId());
        }
    }

    private void reconcileIdentity(IdentityKind kind, String identityId, SyncTally tally, Runnable work) {
        String key = IdentityEvent.identityKey(kind, identityId);
        locks.withLock(key, () -> {
            SyncLogContext.set(kind, identityId);
            try {
                work.run();
                conflicts.clear(key);
            } catch (NamingConflictException e) {
                tally.conflicts++;
                flagConflict(key, e);
            } catch (RuntimeException e) {
                tally.failures++;
                log.warn("Reconciling {} failed", key, e);
            } finally {
                SyncLogContext.clear();
            }
            return null;
        });
    }

    private void flagConflict(String identityKey, NamingConflictException e) {
        conflicts.flag(identityKey, e.identifier(), e.roleName(), e.getMessage());
        metrics.recordConflict();
        log.error("{}; {} left unsynchronized", e.getMessage(), identityKey);
    }

    /** A new CREATED cancels a deletion still waiting on the same identity. */
    private boolean cancelPendingDeletion(IdentityEvent event) {
        boolean cancelled = false;
        for (PendingEvent pending : pendingStore.pendingFor(event.identityKey())) {
            if (pending.event().type() == IdentityEventType.DELETED
                    && !pending.eventId().equals(event.eventId())) {
                pendingStore.remove(pending.eventId());
                cancelled = true;
                log.info("Pending removal of {} cancelled by re-creation", event.identityKey());
            }
        }
        return cancelled;
    }

    private void dropOtherPending(IdentityEvent deletion) {
        for (PendingEvent pending : pendingStore.pendingFor(deletion.identityKey())) {
            if (!pending.eventId().equals(deletion.eventId())) {
                pendingStore.remove(pending.eventId());
                log.debug("Dropped pending {} for deleted {}", pending.event().type(), deletion.identityKey());
            }
        }
    }

    /**
     * Members named by {@code event} are settled by it, so older queued membership changes for the
     * same group no longer apply to them.
     */
    private void supersedePendingMembers(IdentityEvent event) {
        Set<String> touched = new HashSet<>(event.addedMembers());
        touched.addAll(event.removedMembers());
        for (PendingEvent pending : pendingStore.pendingFor(event.identityKey())) {
            IdentityEvent queued = pending.event();
            if (queued.type() != IdentityEventType.MEMBERSHIP_CHANGED
                    || queued.eventId().equals(event.eventId())) {
                continue;
            }
            Set<String> added = new TreeSet<>(queued.addedMembers());
            Set<String> removed = new TreeSet<>(queued.removedMembers());
            boolean addedChanged = added.removeAll(touched);
            boolean removedChanged = removed.removeAll(touched);
            if (!addedChanged && !removedChanged) {
                continue;
            }
            pendingStore.remove(queued.eventId());
            if (!added.isEmpty() || !removed.isEmpty()) {
                pendingStore.enqueue(IdentityEventFactory.remainder(queued, added, removed), pending.lastError());
            }
        }
    }

    private boolean isOutdated(IdentityEvent event) {
        String aspect = orderingAspect(event.type());
        if (aspect == null) {
            return false;
        }
        Instant applied = lastApplied.get(event.identityKey() + "#" + aspect);
        return applied != null && event.occurredAt().isBefore(applied);
    }

    /**
     * Records that {@code event} applied and drops queued events of the same kind that it
     * overrides, so a retry cannot roll the role back to an older name or login state.
     */
    private void markApplied(IdentityEvent event) {
        String aspect = orderingAspect(event.type());
        if (aspect == null) {
            return;
        }
        lastApplied.merge(event.identityKey() + "#" + aspect, event.occurredAt(),
                (a, b) -> a.isAfter(b) ? a : b);
        for (PendingEvent pending : pendingStore.pendingFor(event.identityKey())) {
            IdentityEvent queued = pending.event();
            if (!queued.eventId().equals(event.eventId())
                    && aspect.equals(orderingAspect(queued.type()))
                    && !queued.occurredAt().isAfter(event.occurredAt())) {
                pendingStore.remove(queued.eventId());
                log.info("Dropped pending {} for {}, overridden by a later change", queued.type(), event.identityKey());
            }
        }
    }

    /** Event types that overwrite the same role attribute, or null when the type is not ordered. */
    private static String orderingAspect(IdentityEventType type) {
        return switch (type) {
            case RENAMED -> "name";
            case DEACTIVATED, REACTIVATED -> "login";
            default -> null;
        };
    }

    private boolean stillQueued(PendingEvent pending) {
        return pendingStore.pendingFor(pending.identityKey()).stream()
                .anyMatch(p -> p.eventId().equals(pending.eventId()));
    }

    private static RoleKind roleKind(IdentityKind kind) {
        return kind == IdentityKind.USER ? RoleKind.USER_ROLE : RoleKind.GROUP_ROLE;
    }

    private static IdentityKind identityKind(RoleKind kind) {
        return kind == RoleKind.USER_ROLE ? IdentityKind.USER : IdentityKind.GROUP;
    }

    private record Step(SyncStatus status, String message, IdentityEvent requeue) {

        static Step of(SyncStatus status, String message) {
            return new Step(status, message, null);
        }

        static Step done(SyncTally tally, String message) {
            return of(tally.changed() ? SyncStatus.APPLIED : SyncStatus.UNCHANGED, message);
        }
    }
}
