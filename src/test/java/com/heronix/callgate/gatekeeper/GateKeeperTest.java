package com.heronix.callgate.gatekeeper;

import static com.heronix.callgate.support.ProtocolAssertions.assertProtocolError;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.ProtocolEventType;
import com.heronix.callgate.model.enums.RegistrationStatus;
import com.heronix.callgate.support.CallGateTestSupport;

class GateKeeperTest extends CallGateTestSupport {

    private static final Selector FIRST = Selector.parse("0xaaaaaaaa");
    private static final Selector SECOND = Selector.parse("0xbbbbbbbb");
    private static final Selector THIRD = Selector.parse("0xcccccccc");

    private Address routerAddress;
    private Address identity;

    @BeforeEach
    void setUp() {
        routerAddress = gateKeeper.getRouter();
        identity = Address.random();
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    @Test
    void preRegisterMovesUnregisteredToPending() {
        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.UNREGISTERED);

        gateKeeper.preRegister(identity);
        gateKeeper.preRegister(identity);

        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.PENDING);
        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.INACTIVE);
        assertThat(eventService.getEvents(identity, ProtocolEventType.REGISTRATION_STATUS_UPDATED)).hasSize(2);
    }

    @Test
    void preRegisterDoesNotDowngradeARegisteredIdentity() {
        gateKeeper.preRegister(identity);
        gateKeeper.completeRegistration(routerAddress, identity, identity);

        assertProtocolError(() -> gateKeeper.preRegister(identity), ProtocolError.ALREADY_REGISTERED);
        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.REGISTERED);
    }

    @Test
    void onlyTheRouterCompletesRegistration() {
        gateKeeper.preRegister(identity);

        assertProtocolError(() -> gateKeeper.completeRegistration(identity, identity, identity), ProtocolError.NOT_ROUTER);
        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.PENDING);
    }

    @Test
    void completeRegistrationActivatesBothIdentities() {
        Address front = Address.random();
        gateKeeper.preRegister(identity);
        gateKeeper.preRegister(front);

        gateKeeper.completeRegistration(routerAddress, front, identity);

        assertThat(gateKeeper.getIntegrationStatus(identity).registrationStatus()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getIntegrationStatus(identity).authorizationStatus()).isEqualTo(AuthorizationStatus.ACTIVE);
        assertThat(gateKeeper.getIntegrationStatus(front).registrationStatus()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getIntegrationStatus(front).authorizationStatus()).isEqualTo(AuthorizationStatus.ACTIVE);
        assertThat(eventService.getEvents(front, ProtocolEventType.AUTHORIZATION_STATUS_UPDATED)).hasSize(1);
    }

    @Test
    void completeRegistrationRequiresPendingIntegration() {
        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, identity, identity),
                ProtocolError.NOT_REGISTERED_PENDING);

        gateKeeper.preRegister(identity);
        gateKeeper.completeRegistration(routerAddress, identity, identity);

        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, identity, identity),
                ProtocolError.NOT_REGISTERED_PENDING);
    }

    @Test
    void completeRegistrationRejectsUnknownFrontWithoutPartialWrites() {
        Address front = Address.random();
        gateKeeper.preRegister(identity);

        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, front, identity),
                ProtocolError.NOT_REGISTERED_PENDING);

        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.PENDING);
        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.INACTIVE);
    }

    @Test
    void completeRegistrationRejectsUnknownImplementation() {
        Address front = Address.random();
        gateKeeper.preRegister(front);

        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, front, identity),
                ProtocolError.NOT_REGISTERED_PENDING);
        assertThat(gateKeeper.getRegistrationStatus(front)).isEqualTo(RegistrationStatus.PENDING);
    }

    @Test
    void sharedImplementationRegistersUnderEveryFront() {
        Address first = Address.random();
        Address second = Address.random();
        gateKeeper.preRegister(identity);
        gateKeeper.preRegister(first);
        gateKeeper.preRegister(second);

        gateKeeper.completeRegistration(routerAddress, first, identity);
        router.overrideAuthorization(OPERATOR, identity, AuthorizationStatus.BYPASSED);
        gateKeeper.completeRegistration(routerAddress, second, identity);

        assertThat(gateKeeper.getIntegrationStatus(second).registrationStatus()).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getIntegrationStatus(second).authorizationStatus()).isEqualTo(AuthorizationStatus.ACTIVE);
        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.BYPASSED);
        assertThat(eventService.getEvents(identity, ProtocolEventType.REGISTRATION_STATUS_UPDATED)).hasSize(2);

        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, second, identity),
                ProtocolError.NOT_REGISTERED_PENDING);
    }

    @Test
    void revokedImplementationCannotGainNewFronts() {
        Address first = Address.random();
        Address second = Address.random();
        gateKeeper.preRegister(identity);
        gateKeeper.preRegister(first);
        gateKeeper.preRegister(second);
        gateKeeper.completeRegistration(routerAddress, first, identity);
        router.overrideAuthorization(OPERATOR, identity, AuthorizationStatus.REVOKED);

        assertProtocolError(() -> gateKeeper.completeRegistration(routerAddress, second, identity),
                ProtocolError.INTEGRATION_REVOKED);

        assertThat(gateKeeper.getRegistrationStatus(second)).isEqualTo(RegistrationStatus.PENDING);
        assertThat(gateKeeper.getAuthorizationStatus(second)).isEqualTo(AuthorizationStatus.INACTIVE);
    }

    // ========================================================================
    // FUNCTION PROTECTION
    // ========================================================================

    @Test
    void flagsCanOnlyBeWrittenBySelf() {
        register(identity);

        assertProtocolError(() -> gateKeeper.updateFlags(Address.random(), identity, List.of(FIRST), List.of(true)),
                ProtocolError.NOT_SELF);
        assertThat(gateKeeper.queryFlag(identity, FIRST)).isFalse();
    }

    @Test
    void flagsRequireCompletedRegistration() {
        gateKeeper.preRegister(identity);

        assertProtocolError(() -> gateKeeper.updateFlags(identity, identity, List.of(FIRST), List.of(true)),
                ProtocolError.INTEGRATION_NOT_REGISTERED);
    }

    @Test
    void mismatchedBatchIsRejectedBeforeAnyWrite() {
        register(identity);
        gateKeeper.updateFlags(identity, identity, List.of(FIRST), List.of(true));

        assertProtocolError(() -> gateKeeper.updateFlags(identity, identity,
                List.of(FIRST, SECOND), List.of(false)), ProtocolError.ARRAY_LENGTH_MISMATCH);

        assertThat(gateKeeper.queryFlags(identity, List.of(FIRST, SECOND))).containsExactly(true, false);
    }

    @Test
    void emptyFlagEntriesAreRejectedBeforeAnyWrite() {
        register(identity);

        assertProtocolError(() -> gateKeeper.updateFlags(identity, identity,
                List.of(FIRST, SECOND), Arrays.asList(true, null)), ProtocolError.INVALID_FLAG);
        assertProtocolError(() -> gateKeeper.updateFlags(identity, identity,
                Arrays.asList(FIRST, null), List.of(true, true)), ProtocolError.INVALID_FLAG);

        assertThat(gateKeeper.queryFlag(identity, FIRST)).isFalse();
        assertThat(eventService.getEvents(identity, ProtocolEventType.FUNCTION_PROTECTION_UPDATED)).isEmpty();
    }

    @Test
    void batchUpdateReplacesFlagsAndEmitsOneEvent() {
        register(identity);

        gateKeeper.updateFlags(identity, identity, List.of(FIRST, SECOND), List.of(true, true));
        gateKeeper.updateFlags(identity, identity, List.of(SECOND, THIRD), List.of(false, true));
        gateKeeper.updateFlags(identity, identity, List.of(SECOND, THIRD), List.of(false, true));

        assertThat(gateKeeper.queryFlags(identity, List.of(THIRD, FIRST, SECOND))).containsExactly(true, true, false);
        assertThat(eventService.getEvents(identity, ProtocolEventType.FUNCTION_PROTECTION_UPDATED)).hasSize(3);
    }

    @Test
    void flagQueriesRejectUnknownIdentities() {
        assertProtocolError(() -> gateKeeper.queryFlag(identity, FIRST), ProtocolError.INTEGRATION_NOT_REGISTERED);
        assertProtocolError(() -> gateKeeper.queryFlags(identity, List.of(FIRST)), ProtocolError.INTEGRATION_NOT_REGISTERED);

        gateKeeper.preRegister(identity);

        assertThat(gateKeeper.queryFlag(identity, FIRST)).isFalse();
    }

    // ========================================================================
    // UPGRADES
    // ========================================================================

    @Test
    void preAuthorizeUpgradeRecordsTheSuccessorOnly() {
        Address next = Address.random();
        register(identity);

        gateKeeper.preAuthorizeUpgrade(identity, identity, next);

        assertThat(gateKeeper.getPreAuthorizedSuccessor(identity)).contains(next);
        assertThat(gateKeeper.getRegistrationStatus(next)).isEqualTo(RegistrationStatus.UNREGISTERED);
        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(eventService.getEvents(identity, ProtocolEventType.UPGRADE_PRE_AUTHORIZED)).hasSize(1);
    }

    @Test
    void preAuthorizeUpgradePreconditions() {
        Address next = Address.random();
        register(identity);

        assertProtocolError(() -> gateKeeper.preAuthorizeUpgrade(next, identity, next), ProtocolError.NOT_SELF);
        assertProtocolError(() -> gateKeeper.preAuthorizeUpgrade(identity, identity, identity),
                ProtocolError.ONLY_DISTINCT_IMPLEMENTATION);
        assertThat(gateKeeper.getPreAuthorizedSuccessor(identity)).isEmpty();
    }

    @Test
    void completeUpgradeHandsRegistrationAndFlagsToTheSuccessor() {
        Address next = Address.random();
        gateKeeper.preRegister(next);
        register(identity);
        gateKeeper.updateFlags(identity, identity, List.of(FIRST, SECOND), List.of(true, false));
        gateKeeper.preAuthorizeUpgrade(identity, identity, next);

        gateKeeper.completeUpgrade(identity, identity, next);

        assertThat(gateKeeper.getRegistrationStatus(next)).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getAuthorizationStatus(next)).isEqualTo(AuthorizationStatus.ACTIVE);
        assertThat(gateKeeper.queryFlags(next, List.of(FIRST, SECOND))).containsExactly(true, false);
        assertThat(gateKeeper.queryFlag(identity, FIRST)).isTrue();
        assertThat(eventService.getEvents(next, ProtocolEventType.FUNCTION_PROTECTION_UPDATED)).hasSize(1);
    }

    @Test
    void completeUpgradeKeepsARevocation() {
        Address next = Address.random();
        register(identity);
        gateKeeper.preAuthorizeUpgrade(identity, identity, next);
        router.overrideAuthorization(OPERATOR, identity, AuthorizationStatus.REVOKED);

        gateKeeper.completeUpgrade(identity, identity, next);

        assertThat(gateKeeper.getRegistrationStatus(next)).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getAuthorizationStatus(next)).isEqualTo(AuthorizationStatus.REVOKED);
    }

    @Test
    void completeUpgradeRequiresThePreAuthorizedSuccessor() {
        Address next = Address.random();
        Address other = Address.random();
        register(identity);

        assertProtocolError(() -> gateKeeper.completeUpgrade(identity, identity, next),
                ProtocolError.UPGRADE_NOT_PRE_AUTHORIZED);

        gateKeeper.preAuthorizeUpgrade(identity, identity, next);

        assertProtocolError(() -> gateKeeper.completeUpgrade(identity, identity, other),
                ProtocolError.UPGRADE_NOT_PRE_AUTHORIZED);
        assertProtocolError(() -> gateKeeper.completeUpgrade(next, identity, next), ProtocolError.NOT_SELF);
        assertThat(gateKeeper.getRegistrationStatus(next)).isEqualTo(RegistrationStatus.UNREGISTERED);
        assertThat(gateKeeper.getRegistrationStatus(other)).isEqualTo(RegistrationStatus.UNREGISTERED);
    }

    // ========================================================================
    // OVERRIDES
    // ========================================================================

    @Test
    void overridesAreRouterOnly() {
        assertProtocolError(() -> gateKeeper.overrideAuthorization(identity, identity, AuthorizationStatus.BYPASSED),
                ProtocolError.NOT_ROUTER);
        assertProtocolError(() -> gateKeeper.overrideRegistration(OPERATOR, identity, RegistrationStatus.REGISTERED),
                ProtocolError.NOT_ROUTER);
    }

    @Test
    void batchOverridesWriteEveryIdentity() {
        Address other = Address.random();

        gateKeeper.overrideAuthorizations(routerAddress, List.of(identity, other),
                List.of(AuthorizationStatus.REVOKED, AuthorizationStatus.BYPASSED));
        gateKeeper.overrideRegistrations(routerAddress, List.of(identity, other),
                List.of(RegistrationStatus.REGISTERED, RegistrationStatus.PENDING));

        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.REVOKED);
        assertThat(gateKeeper.getAuthorizationStatus(other)).isEqualTo(AuthorizationStatus.BYPASSED);
        assertThat(gateKeeper.getRegistrationStatus(identity)).isEqualTo(RegistrationStatus.REGISTERED);
        assertThat(gateKeeper.getRegistrationStatus(other)).isEqualTo(RegistrationStatus.PENDING);
    }

    @Test
    void batchOverrideWithMismatchedListsWritesNothing() {
        Address other = Address.random();

        assertProtocolError(() -> gateKeeper.overrideAuthorizations(routerAddress, List.of(identity, other),
                List.of(AuthorizationStatus.REVOKED)), ProtocolError.ARRAY_LENGTH_MISMATCH);

        assertThat(gateKeeper.getAuthorizationStatus(identity)).isEqualTo(AuthorizationStatus.INACTIVE);
        assertThat(eventService.countEvents(identity)).isZero();
    }

    private void register(Address address) {
        gateKeeper.preRegister(address);
        gateKeeper.completeRegistration(routerAddress, address, address);
    }
}
