package com.rolebridge.security.role;

import java.util.Optional;

/**
 * Classification of a database role from the synchronizer's point of view.
 *
 * <p>Only {@link #USER_ROLE} and {@link #GROUP_ROLE} roles are ever created, altered or dropped by
 * RoleBridge. {@link #UNMANAGED} roles (administrators, other applications, backup accounts) are
 * read but never mutated.
 */
public enum RoleKind {
    USER_ROLE("user"),
    GROUP_ROLE("group"),
    UNMANAGED(null);

    private final String markerValue;

    RoleKind(String markerValue) {
        this.markerValue = markerValue;
    }

    /** Value written into the role marker, null for {@link #UNMANAGED}. */
    public String markerValue() {
        return markerValue;
    }

    public boolean isManaged() {
        return this != UNMANAGED;
    }

    /** Resolves a managed kind from its marker value. */
    public static Optional<RoleKind> fromMarkerValue(String value) {
        for (RoleKind kind : values()) {
            if (kind.markerValue != null && kind.markerValue.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
