package com.heronix.callgate.router;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.callgate.adapter.SecurityModule;
import com.heronix.callgate.config.CallGateProperties;
import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.gatekeeper.GateKeeper;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.ModuleId;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Protocol router - validates registrar credentials and dispatches protected calls
 * to security modules.
 *
 * The router keeps no per-integration state. Everything it decides is derived from the
 * GateKeeper ledger, the configured administrator set and the installed modules, so it
 * can be replaced without losing anything.
 */
@Service
@Slf4j
public class ProtocolRouter {

    private final Address address;
    private final Set<Address> protocolAdmins;
    private final GateKeeper gateKeeper;
    private final RegistrarSignatureVerifier signatureVerifier;
    private final Map<ModuleId, SecurityModule> securityModules;

    public ProtocolRouter(
            CallGateProperties properties,
            GateKeeper gateKeeper,
            RegistrarSignatureVerifier signatureVerifier,
            Map<ModuleId, SecurityModule> securityModules) {

        this.address = Address.of(properties.getRouter().getAddress());
        this.protocolAdmins = properties.getRouter().getProtocolAdmins().stream()
                .map(Address::of)
                .collect(Collectors.toUnmodifiableSet());
        this.gateKeeper = gateKeeper;
        this.signatureVerifier = signatureVerifier;
        this.securityModules = Map.copyOf(securityModules);

        if (!address.equals(gateKeeper.getRouter())) {
            log.warn("ROUTER: GateKeeper expects router {} but this router is {}; privileged ledger calls will fail",
                    gateKeeper.getRouter(), address);
        }

        log.info("ROUTER: Initialized at {} - {} module(s), {} protocol admin(s)",
                address, this.securityModules.size(), protocolAdmins.size());
    }

    public Address getAddress() {
        return address;
    }

    public Collection<SecurityModule> getInstalledModules() {
        return securityModules.values();
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Complete the registration of an integration with a registrar credential.
     *
     * The credential binds the front address to the admin, so it cannot be replayed
     * for another front of a shared logic unit.
     *
     * @param integration    address the integration is reached at; the credential was issued for it
     * @param implementation self-identity of the logic unit
     * @param admin          current security admin of the integration
     * @param credential     65-byte registrar signature
     * @return {@code true} once the ledger has been updated
     */
    @Transactional
    public boolean completeRegistration(Address integration, Address implementation, Address admin, byte[] credential) {
        if (credential == null || credential.length != RegistrarSignatureVerifier.CREDENTIAL_LENGTH) {
            throw new ProtocolException(ProtocolError.INVALID_CREDENTIAL_LENGTH);
        }

        if (!signatureVerifier.verify(integration, admin, credential)) {
            log.warn("ROUTER: Invalid registrar credential for {} (admin {})", integration, admin);
            throw new ProtocolException(ProtocolError.INVALID_REGISTRAR_SIGNATURE);
        }

        try {
            gateKeeper.completeRegistration(address, integration, implementation);
        } catch (ProtocolException e) {
            throw new ProtocolException(ProtocolError.REGISTRATION_FAILED,
                    "Registration failed: " + e.getCode(), e);
        }

        log.info("ROUTER: Registered integration {} (implementation {})", integration, implementation);
        return true;
    }

    // ========================================================================
    // PROTECTED CALL DISPATCH
    // ========================================================================

    /**
     * Forward a protected call to the security module named in its payload.
     *
     * @param integration address the integration is reached at
     * @return the module's verdict, or {@code true} for bypassed integrations
     */
    @Transactional(readOnly = true)
    public boolean dispatchProtectedCall(Address integration, ProtectedCall call) {
        AuthorizationStatus status = resolveAuthorization(integration, call.integration());

        switch (status) {
            case REVOKED -> {
                log.warn("ROUTER: Protected call to revoked integration {} from {}", call.integration(), call.caller());
                throw new ProtocolException(ProtocolError.INTEGRATION_REVOKED);
            }
            case BYPASSED -> {
                log.debug("ROUTER: Integration {} bypassed, permitting call from {}", call.integration(), call.caller());
                return true;
            }
            case ACTIVE -> {
                // forwarded below
            }
            default -> throw new ProtocolException(ProtocolError.INTEGRATION_NOT_ACTIVE,
                    "Integration " + call.integration() + " is " + status);
        }

        if (call.payloadLength() < ModuleId.OFFSET + ModuleId.LENGTH) {
            throw new ProtocolException(ProtocolError.PAYLOAD_TOO_SHORT);
        }

        ModuleId moduleId = call.moduleId();
        SecurityModule module = securityModules.get(moduleId);
        if (module == null) {
            throw new ProtocolException(ProtocolError.MODULE_NOT_INSTALLED, "No module installed for " + moduleId);
        }

        boolean permitted = module.validate(call);

        if (permitted) {
            log.debug("ROUTER: Module {} permitted call from {} to {}", module.getName(), call.caller(), call.integration());
        } else {
            log.warn("ROUTER: Module {} denied call from {} to {}", module.getName(), call.caller(), call.integration());
        }
        return permitted;
    }

    // ========================================================================
    // ADMINISTRATOR OVERRIDES
    // ========================================================================

    @Transactional
    public void overrideAuthorization(Address operator, Address identity, AuthorizationStatus status) {
        overrideAuthorizations(operator, List.of(identity), List.of(status));
    }

    @Transactional
    public void overrideAuthorizations(Address operator, List<Address> identities, List<AuthorizationStatus> statuses) {
        requireProtocolAdmin(operator);
        gateKeeper.overrideAuthorizations(address, identities, statuses);
        log.info("ROUTER: Operator {} overrode authorization of {} identity(ies)", operator, identities.size());
    }

    @Transactional
    public void overrideRegistration(Address operator, Address identity, RegistrationStatus status) {
        overrideRegistrations(operator, List.of(identity), List.of(status));
    }

    @Transactional
    public void overrideRegistrations(Address operator, List<Address> identities, List<RegistrationStatus> statuses) {
        requireProtocolAdmin(operator);
        gateKeeper.overrideRegistrations(address, identities, statuses);
        log.info("ROUTER: Operator {} overrode registration of {} identity(ies)", operator, identities.size());
    }

    public boolean isProtocolAdmin(Address operator) {
        return protocolAdmins.contains(operator);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    /**
     * A revocation of either the front or the logic unit wins; otherwise the logic unit decides.
     */
    private AuthorizationStatus resolveAuthorization(Address integration, Address implementation) {
        AuthorizationStatus implementationStatus = gateKeeper.getAuthorizationStatus(implementation);
        if (integration != null && !integration.equals(implementation)
                && gateKeeper.getAuthorizationStatus(integration) == AuthorizationStatus.REVOKED) {
            return AuthorizationStatus.REVOKED;
        }
        return implementationStatus;
    }

    private void requireProtocolAdmin(Address operator) {
        if (operator == null || !protocolAdmins.contains(operator)) {
            log.warn("ROUTER: Rejected administrator call from {}", operator);
            throw new ProtocolException(ProtocolError.NOT_PROTOCOL_ADMIN);
        }
    }
}
