package com.rolebridge.security.role;

import java.util.Optional;

/**
 * Tag stored on every managed role (as the role's database comment) linking it to the stable id of
 * the application identity it mirrors, e.g. {@code rolebridge:user:42}.
 *
 * <p>A role without a parsable marker is {@link RoleKind#UNMANAGED}.
 *
 * @param kind managed role kind
 * @param identityId stable identifier of the user or group
 */
public record RoleMarker(RoleKind kind, String identityId) {

    /** Prefix shared by every marker. */
    public static final String PREFIX = "rolebridge:";

    public RoleMarker {
        if (kind == null || !kind.isManaged()) {
            throw new IllegalArgumentException("marker kind must be USER_ROLE or GROUP_ROLE");
        }
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("identityId must not be null or blank");
        }
    }

    /** Text stored on the role. */
    public String text() {
        return PREFIX + kind.markerValue() + ":" + identityId;
    }

    /**
     * Parses marker text.
     *
     * @param text stored comment, may be null
     * @return the marker, or empty if the text is not a RoleBridge marker
     */
    public static Optional<RoleMarker> parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String rest = text.substring(PREFIX.length());
        int colon = rest.indexOf(':');
        if (colon <= 0 || colon == rest.length() - 1) {
            return Optional.empty();
        }
        String id = rest.substring(colon + 1);
        return RoleKind.fromMarkerValue(rest.substring(0, colon))
                .map(kind -> new RoleMarker(kind, id));
    }

    @Override
    public String toString() {
        return text();
    }
}
