package com.rolebridge.identity;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that an {@link IdentityEvent} carries everything its type needs.
 *
 * <p>Returns all errors at once so a rejected event can be logged with the full reason.
 */
public final class IdentityEventValidator {

    private IdentityEventValidator() {
        // utility class
    }

    /**
     * Validates the required fields of an identity event.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(IdentityEvent event) {
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (event.type() == null) {
            errors.add("type must not be null");
        }
        if (event.kind() == null) {
            errors.add("kind must not be null");
        }
        if (isBlank(event.identityId())) {
            errors.add("identityId must not be null or blank");
        }
        if (isBlank(event.name())) {
            errors.add("name must not be null or blank");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }

        if (event.type() != null && event.kind() != null) {
            if (event.type().userOnly() && event.kind() != IdentityKind.USER) {
                errors.add(event.type().value() + " applies to users only");
            }
            if (event.type().groupOnly() && event.kind() != IdentityKind.GROUP) {
                errors.add(event.type().value() + " applies to groups only");
            }
            if (event.kind() == IdentityKind.USER
                    && !(event.addedMembers().isEmpty() && event.removedMembers().isEmpty())) {
                errors.add("user events must not carry members");
            }
        }
        if (event.type() == IdentityEventType.RENAMED && isBlank(event.previousName())) {
            errors.add("Renamed requires previousName");
        }
        if (event.type() == IdentityEventType.MEMBERSHIP_CHANGED) {
            for (String member : event.addedMembers()) {
                if (event.removedMembers().contains(member)) {
                    errors.add("member '" + member + "' is both added and removed");
                }
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
