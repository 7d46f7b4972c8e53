package com.heronix.callgate.gatekeeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.callgate.config.CallGateProperties;
import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.FunctionProtection;
import com.heronix.callgate.model.domain.IntegrationRecord;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.model.dto.IntegrationStatusDTO;
import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;
import com.heronix.callgate.model.event.ProtocolEvent;
import com.heronix.callgate.repository.FunctionProtectionRepository;
import com.heronix.callgate.repository.IntegrationRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * The authoritative ledger of registration status, authorization status and
 * protection flags.
 *
 * The GateKeeper is permissionless to read. Writes are self-authenticated: an identity
 * may only touch its own entries, and status overrides are only accepted from the router.
 * The router address is fixed at construction so the router can be replaced without
 * losing ledger state.
 *
 * Every mutator takes the address of its caller as first argument.
 */
@Service
@Slf4j
public class GateKeeper {

    private final Address address;
    private final Address router;
    private final IntegrationRecordRepository integrationRepository;
    private final FunctionProtectionRepository protectionRepository;
    private final ApplicationEventPublisher eventPublisher;

    public GateKeeper(
            CallGateProperties properties,
            IntegrationRecordRepository integrationRepository,
            FunctionProtectionRepository protectionRepository,
            ApplicationEventPublisher eventPublisher) {

        this.address = Address.of(properties.getGatekeeper().getAddress());
        this.router = Address.of(properties.getRouter().getAddress());
        this.integrationRepository = integrationRepository;
        this.protectionRepository = protectionRepository;
        this.eventPublisher = eventPublisher;

        log.info("GATEKEEPER: Initialized at {} - router: {}", address, router);
    }

    public Address getAddress() {
        return address;
    }

    public Address getRouter() {
        return router;
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Mark the caller as pending registration.
     *
     * Called by an integration from its constructor or initializer. Repeated calls re-emit
     * {@code PENDING}; an identity that already completed registration is rejected.
     */
    @Transactional
    public void preRegister(Address caller) {
        IntegrationRecord record = findOrCreate(caller);
        if (record.isRegistered()) {
            log.warn("GATEKEEPER: Rejected pre-registration of registered identity {}", caller);
            throw new ProtocolException(ProtocolError.ALREADY_REGISTERED);
        }

        setRegistration(record, RegistrationStatus.PENDING);
        integrationRepository.save(record);

        log.info("GATEKEEPER: Pre-registered {}", caller);
    }

    /**
     * Complete the registration of an integration. Router only.
     *
     * The front must be pending. A logic unit shared by several fronts is activated by
     * the first registration and left as it is by later ones.
     *
     * @param integration    the address the integration is reached at (proxy front or self)
     * @param implementation the self-identity of the logic unit
     */
    @Transactional
    public void completeRegistration(Address caller, Address integration, Address implementation) {
        requireRouter(caller);

        IntegrationRecord frontRecord = findOrCreate(integration);
        if (frontRecord.getRegistrationStatus() != RegistrationStatus.PENDING) {
            throw new ProtocolException(ProtocolError.NOT_REGISTERED_PENDING,
                    "Integration " + integration + " is " + frontRecord.getRegistrationStatus());
        }

        IntegrationRecord implementationRecord = integration.equals(implementation)
                ? frontRecord
                : findOrCreate(implementation);
        if (implementationRecord.getRegistrationStatus() == RegistrationStatus.UNREGISTERED) {
            throw new ProtocolException(ProtocolError.NOT_REGISTERED_PENDING,
                    "Implementation " + implementation + " was never pre-registered");
        }
        if (frontRecord.getAuthorizationStatus() == AuthorizationStatus.REVOKED
                || implementationRecord.getAuthorizationStatus() == AuthorizationStatus.REVOKED) {
            log.warn("GATEKEEPER: Rejected registration of {} over revoked identity", integration);
            throw new ProtocolException(ProtocolError.INTEGRATION_REVOKED);
        }

        activate(frontRecord);
        if (implementationRecord != frontRecord && !implementationRecord.isRegistered()) {
            activate(implementationRecord);
        }

        log.info("GATEKEEPER: Registration completed - integration: {}, implementation: {}",
                integration, implementation);
    }

    // ========================================================================
    // FUNCTION PROTECTION
    // ========================================================================

    /**
     * Replace a batch of protection flags of the calling identity.
     */
    @Transactional
    public void updateFlags(Address caller, Address identity, List<Selector> selectors, List<Boolean> flags) {
        if (!caller.equals(identity)) {
            throw new ProtocolException(ProtocolError.NOT_SELF);
        }
        if (selectors.size() != flags.size()) {
            throw new ProtocolException(ProtocolError.ARRAY_LENGTH_MISMATCH);
        }
        if (selectors.contains(null) || flags.contains(null)) {
            throw new ProtocolException(ProtocolError.INVALID_FLAG);
        }
        requireRegistered(identity);

        Map<Selector, FunctionProtection> existing = protectionRepository
                .findByIdentityAndSelectorIn(identity, selectors)
                .stream()
                .collect(Collectors.toMap(FunctionProtection::getSelector, Function.identity()));

        // later entries win when a selector repeats within the batch
        for (int i = 0; i < selectors.size(); i++) {
            FunctionProtection protection = existing.computeIfAbsent(selectors.get(i), s -> FunctionProtection.builder()
                    .identity(identity)
                    .selector(s)
                    .build());
            protection.setEnabled(flags.get(i));
        }
        protectionRepository.saveAll(new ArrayList<>(existing.values()));

        eventPublisher.publishEvent(
                new ProtocolEvent.FunctionProtectionStatusUpdated(identity, selectors, flags));

        log.info("GATEKEEPER: Updated {} protection flag(s) for {}", selectors.size(), identity);
    }

    /**
     * Protection flag of one operation of an identity.
     *
     * @throws ProtocolException {@code INTEGRATION_NOT_REGISTERED} for identities the ledger never saw
     */
    @Transactional(readOnly = true)
    public boolean queryFlag(Address identity, Selector selector) {
        requireKnown(identity);
        return protectionRepository.findByIdentityAndSelector(identity, selector)
                .map(FunctionProtection::isEnabled)
                .orElse(false);
    }

    /**
     * Protection flags of several operations, in request order.
     */
    @Transactional(readOnly = true)
    public List<Boolean> queryFlags(Address identity, List<Selector> selectors) {
        requireKnown(identity);

        Map<Selector, Boolean> stored = new HashMap<>();
        protectionRepository.findByIdentityAndSelectorIn(identity, selectors)
                .forEach(p -> stored.put(p.getSelector(), p.isEnabled()));

        return selectors.stream()
                .map(s -> stored.getOrDefault(s, false))
                .collect(Collectors.toList());
    }

    // ========================================================================
    // UPGRADES
    // ========================================================================

    /**
     * Record that {@code current} intends to hand over to {@code next}.
     *
     * No status changes here. The successor is only promoted by {@link #completeUpgrade}
     * once the swap actually happens. A later call replaces the recorded successor.
     */
    @Transactional
    public void preAuthorizeUpgrade(Address caller, Address current, Address next) {
        if (!caller.equals(current)) {
            throw new ProtocolException(ProtocolError.NOT_SELF);
        }
        if (current.equals(next)) {
            throw new ProtocolException(ProtocolError.ONLY_DISTINCT_IMPLEMENTATION);
        }
        requireRegistered(current);

        IntegrationRecord record = findOrCreate(current);
        record.setSuccessor(next);
        integrationRepository.save(record);

        eventPublisher.publishEvent(new ProtocolEvent.UpgradePreAuthorized(current, current, next));

        log.info("GATEKEEPER: Upgrade pre-authorized - current: {}, new: {}", current, next);
    }

    /**
     * Carry the registration of {@code current} over to its pre-authorized successor.
     *
     * Called on behalf of the outgoing logic unit while its proxy swaps to {@code next}.
     * The successor inherits REVOKED or BYPASSED authorization and the enabled protection
     * flags. A successor that is already registered, because another front made the same
     * upgrade, is left as it is.
     */
    @Transactional
    public void completeUpgrade(Address caller, Address current, Address next) {
        if (!caller.equals(current)) {
            throw new ProtocolException(ProtocolError.NOT_SELF);
        }
        requireRegistered(current);

        IntegrationRecord currentRecord = findOrCreate(current);
        if (!next.equals(currentRecord.getSuccessor())) {
            log.warn("GATEKEEPER: Upgrade of {} to {} was not pre-authorized", current, next);
            throw new ProtocolException(ProtocolError.UPGRADE_NOT_PRE_AUTHORIZED,
                    "Implementation " + next + " was not pre-authorized by " + current);
        }

        IntegrationRecord nextRecord = findOrCreate(next);
        if (nextRecord.isRegistered()) {
            log.debug("GATEKEEPER: Successor {} of {} already registered", next, current);
            return;
        }

        AuthorizationStatus inherited = switch (currentRecord.getAuthorizationStatus()) {
            case REVOKED, BYPASSED -> currentRecord.getAuthorizationStatus();
            default -> AuthorizationStatus.ACTIVE;
        };
        setRegistration(nextRecord, RegistrationStatus.REGISTERED);
        if (nextRecord.getAuthorizationStatus() != inherited) {
            setAuthorization(nextRecord, inherited);
        }
        integrationRepository.save(nextRecord);

        List<FunctionProtection> enabled = protectionRepository.findByIdentityAndEnabledTrue(current);
        if (!enabled.isEmpty()) {
            List<Selector> selectors = enabled.stream().map(FunctionProtection::getSelector).toList();
            Map<Selector, FunctionProtection> existing = protectionRepository
                    .findByIdentityAndSelectorIn(next, selectors)
                    .stream()
                    .collect(Collectors.toMap(FunctionProtection::getSelector, Function.identity()));
            for (Selector selector : selectors) {
                existing.computeIfAbsent(selector, s -> FunctionProtection.builder()
                        .identity(next)
                        .selector(s)
                        .build())
                        .setEnabled(true);
            }
            protectionRepository.saveAll(new ArrayList<>(existing.values()));
            eventPublisher.publishEvent(new ProtocolEvent.FunctionProtectionStatusUpdated(
                    next, selectors, Collections.nCopies(selectors.size(), Boolean.TRUE)));
        }

        log.info("GATEKEEPER: Upgrade completed - {} succeeded by {} ({}, {} flag(s) carried over)",
                current, next, inherited, enabled.size());
    }

    @Transactional(readOnly = true)
    public Optional<Address> getPreAuthorizedSuccessor(Address identity) {
        return integrationRepository.findByIdentity(identity)
                .map(IntegrationRecord::getSuccessor);
    }

    // ========================================================================
    // ADMINISTRATOR OVERRIDES (router only)
    // ========================================================================

    @Transactional
    public void overrideAuthorization(Address caller, Address identity, AuthorizationStatus status) {
        overrideAuthorizations(caller, List.of(identity), List.of(status));
    }

    @Transactional
    public void overrideAuthorizations(Address caller, List<Address> identities, List<AuthorizationStatus> statuses) {
        requireRouter(caller);
        if (identities.size() != statuses.size()) {
            throw new ProtocolException(ProtocolError.ARRAY_LENGTH_MISMATCH);
        }

        for (int i = 0; i < identities.size(); i++) {
            IntegrationRecord record = findOrCreate(identities.get(i));
            setAuthorization(record, statuses.get(i));
            integrationRepository.save(record);
            log.warn("GATEKEEPER: Authorization of {} overridden to {}", record.getIdentity(), statuses.get(i));
        }
    }

    @Transactional
    public void overrideRegistration(Address caller, Address identity, RegistrationStatus status) {
        overrideRegistrations(caller, List.of(identity), List.of(status));
    }

    @Transactional
    public void overrideRegistrations(Address caller, List<Address> identities, List<RegistrationStatus> statuses) {
        requireRouter(caller);
        if (identities.size() != statuses.size()) {
            throw new ProtocolException(ProtocolError.ARRAY_LENGTH_MISMATCH);
        }

        for (int i = 0; i < identities.size(); i++) {
            IntegrationRecord record = findOrCreate(identities.get(i));
            setRegistration(record, statuses.get(i));
            integrationRepository.save(record);
            log.warn("GATEKEEPER: Registration of {} overridden to {}", record.getIdentity(), statuses.get(i));
        }
    }

    // ========================================================================
    // STATUS QUERIES
    // ========================================================================

    @Transactional(readOnly = true)
    public RegistrationStatus getRegistrationStatus(Address identity) {
        return integrationRepository.findByIdentity(identity)
                .map(IntegrationRecord::getRegistrationStatus)
                .orElse(RegistrationStatus.UNREGISTERED);
    }

    @Transactional(readOnly = true)
    public AuthorizationStatus getAuthorizationStatus(Address identity) {
        return integrationRepository.findByIdentity(identity)
                .map(IntegrationRecord::getAuthorizationStatus)
                .orElse(AuthorizationStatus.INACTIVE);
    }

    @Transactional(readOnly = true)
    public IntegrationStatusDTO getIntegrationStatus(Address identity) {
        return integrationRepository.findByIdentity(identity)
                .map(IntegrationStatusDTO::fromEntity)
                .orElseGet(() -> IntegrationStatusDTO.unknown(identity));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void requireRouter(Address caller) {
        if (!router.equals(caller)) {
            log.warn("GATEKEEPER: Rejected privileged call from {}", caller);
            throw new ProtocolException(ProtocolError.NOT_ROUTER);
        }
    }

    private void requireRegistered(Address identity) {
        if (getRegistrationStatus(identity) != RegistrationStatus.REGISTERED) {
            throw new ProtocolException(ProtocolError.INTEGRATION_NOT_REGISTERED,
                    "Integration " + identity + " is not registered");
        }
    }

    private void requireKnown(Address identity) {
        if (getRegistrationStatus(identity) == RegistrationStatus.UNREGISTERED) {
            throw new ProtocolException(ProtocolError.INTEGRATION_NOT_REGISTERED,
                    "Integration " + identity + " is not registered");
        }
    }

    private IntegrationRecord findOrCreate(Address identity) {
        return integrationRepository.findByIdentity(identity)
                .orElseGet(() -> IntegrationRecord.unregistered(identity));
    }

    private void activate(IntegrationRecord record) {
        if (record.getRegistrationStatus() != RegistrationStatus.REGISTERED) {
            setRegistration(record, RegistrationStatus.REGISTERED);
        }
        if (record.getAuthorizationStatus() != AuthorizationStatus.ACTIVE) {
            setAuthorization(record, AuthorizationStatus.ACTIVE);
        }
        integrationRepository.save(record);
    }

    private void setRegistration(IntegrationRecord record, RegistrationStatus status) {
        RegistrationStatus previous = record.getRegistrationStatus();
        record.setRegistrationStatus(status);
        eventPublisher.publishEvent(
                new ProtocolEvent.RegistrationStatusUpdated(record.getIdentity(), previous, status));
    }

    private void setAuthorization(IntegrationRecord record, AuthorizationStatus status) {
        AuthorizationStatus previous = record.getAuthorizationStatus();
        record.setAuthorizationStatus(status);
        eventPublisher.publishEvent(
                new ProtocolEvent.AuthorizationStatusUpdated(record.getIdentity(), previous, status));
    }
}
