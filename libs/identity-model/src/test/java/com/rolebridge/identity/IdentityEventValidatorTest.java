package com.rolebridge.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IdentityEventValidator")
class IdentityEventValidatorTest {

    private static final ApplicationUser SMITH = ApplicationUser.active("u-1", "smith");
    private static final ApplicationGroup LIBRARIANS =
            new ApplicationGroup("g-1", "librarians", Set.of("u-1"));

    @Nested
    @DisplayName("valid events")
    class Valid {

        @Test
        @DisplayName("factory-built events pass")
        void factoryEventsPass() {
            assertThat(IdentityEventValidator.validate(IdentityEventFactory.userCreated(SMITH)).valid())
                    .isTrue();
            assertThat(IdentityEventValidator.validate(IdentityEventFactory.groupCreated(LIBRARIANS))
                            .valid())
                    .isTrue();
            assertThat(IdentityEventValidator.validate(
                                    IdentityEventFactory.renamed(
                                            IdentityKind.USER, "u-1", "smith", "smithjr"))
                            .valid())
                    .isTrue();
            assertThat(IdentityEventValidator.validate(IdentityEventFactory.deactivated(SMITH))
                            .errors())
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("invalid events")
    class Invalid {

        @Test
        @DisplayName("collects every missing field at once")
        void collectsAllErrors() {
            var event = new IdentityEvent(null, null, null, " ", null, null, null, null, null);

            var result = IdentityEventValidator.validate(event);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors())
                    .contains(
                            "eventId must not be null or blank",
                            "type must not be null",
                            "kind must not be null",
                            "identityId must not be null or blank",
                            "name must not be null or blank",
                            "occurredAt must not be null");
        }

        @Test
        @DisplayName("deactivating a group is rejected")
        void deactivateGroupRejected() {
            var event = new IdentityEvent("e-1", IdentityEventType.DEACTIVATED, IdentityKind.GROUP,
                    "g-1", "librarians", null, Set.of(), Set.of(), Instant.now());

            assertThat(IdentityEventValidator.validate(event).errors())
                    .containsExactly("Deactivated applies to users only");
        }

        @Test
        @DisplayName("membership change on a user is rejected")
        void membershipOnUserRejected() {
            var event = new IdentityEvent("e-1", IdentityEventType.MEMBERSHIP_CHANGED,
                    IdentityKind.USER, "u-1", "smith", null, Set.of("x"), Set.of(), Instant.now());

            assertThat(IdentityEventValidator.validate(event).errors())
                    .contains("MembershipChanged applies to groups only",
                            "user events must not carry members");
        }

        @Test
        @DisplayName("rename without previous name is rejected")
        void renameNeedsPreviousName() {
            var event = new IdentityEvent("e-1", IdentityEventType.RENAMED, IdentityKind.USER,
                    "u-1", "smithjr", null, Set.of(), Set.of(), Instant.now());

            assertThat(IdentityEventValidator.validate(event).errors())
                    .containsExactly("Renamed requires previousName");
        }

        @Test
        @DisplayName("a member cannot be added and removed in the same change")
        void contradictoryMembership() {
            var event = IdentityEventFactory.membershipChanged(
                    LIBRARIANS, Set.of("u-1"), Set.of("u-1"));

            assertThat(IdentityEventValidator.validate(event).errors())
                    .containsExactly("member 'u-1' is both added and removed");
        }
    }
}
