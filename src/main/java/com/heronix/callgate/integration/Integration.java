package com.heronix.callgate.integration;

import java.util.Collections;
import java.util.List;

import org.springframework.context.ApplicationEventPublisher;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.gatekeeper.GateKeeper;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.router.ProtectedCall;
import com.heronix.callgate.router.ProtocolRouter;

import lombok.extern.slf4j.Slf4j;

/**
 * Base class of a protected logic unit.
 *
 * A logic unit knows its self-identity from construction on. Every operation runs
 * against a {@link CallFrame} supplied by a host; guarded operations start with
 * {@link #guard(CallFrame, Selector, byte[])}.
 *
 * Subclasses decide where protection flags live and which hosts may run them.
 */
@Slf4j
public abstract class Integration<S extends IntegrationStorage> {

    /**
     * Module marker (4 bytes), module id (32 bytes) and room for the module's own data.
     */
    public static final int MIN_PAYLOAD_LENGTH = 64;

    private final Address self;
    private final ProtocolRouter router;
    private final GateKeeper gateKeeper;
    private final ApplicationEventPublisher eventPublisher;

    protected Integration(Address self, IntegrationEnvironment environment) {
        if (self == null) {
            throw new IllegalArgumentException("Self-identity is required");
        }
        this.self = self;
        this.router = environment.getRouter();
        this.gateKeeper = environment.getGateKeeper();
        this.eventPublisher = environment.getEventPublisher();
    }

    public Address getSelf() {
        return self;
    }

    protected ProtocolRouter getRouter() {
        return router;
    }

    protected GateKeeper getGateKeeper() {
        return gateKeeper;
    }

    protected ApplicationEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    /**
     * Reject frames whose storage this logic unit must not execute against.
     */
    protected abstract void checkIdentity(CallFrame<S> frame);

    protected abstract boolean readFlag(CallFrame<S> frame, Selector selector);

    protected abstract void writeFlags(CallFrame<S> frame, List<Selector> selectors, List<Boolean> flags);

    // ========================================================================
    // GUARD
    // ========================================================================

    /**
     * Gate a protected operation. Returns normally when the operation body may run.
     *
     * @param selector operation being invoked
     * @param payload  security payload supplied by the caller
     */
    protected final void guard(CallFrame<S> frame, Selector selector, byte[] payload) {
        checkIdentity(frame);

        if (!readFlag(frame, selector)) {
            return;
        }

        if (payload == null || payload.length < MIN_PAYLOAD_LENGTH) {
            throw new ProtocolException(ProtocolError.PAYLOAD_TOO_SHORT,
                    "Payload of " + (payload == null ? 0 : payload.length) + " bytes for " + selector);
        }

        ProtectedCall call = new ProtectedCall(frame.caller(), self, frame.value(),
                payload.length, frame.data(), payload);

        boolean permitted;
        try {
            permitted = router.dispatchProtectedCall(frame.target(), call);
        } catch (ProtocolException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("INTEGRATION: Dispatch of {} on {} failed", selector, self, e);
            throw new ProtocolException(ProtocolError.DISPATCH_FAILED,
                    "Protected call dispatch failed: " + e.getMessage(), e);
        }

        if (!permitted) {
            log.warn("INTEGRATION: {} on {} denied for {}", selector, self, frame.caller());
            throw new ProtocolException(ProtocolError.MODULE_DENIED);
        }
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Complete registration with a registrar credential and enable protection for
     * the given selectors in the same step. Security admin only.
     */
    public boolean registerWithDefaults(CallFrame<S> frame, byte[] credential, List<Selector> enabledByDefault) {
        checkIdentity(frame);
        AdminTransfer administration = frame.storage().administration();
        administration.requireAdmin(frame.caller());

        router.completeRegistration(frame.target(), self, administration.getAdmin(), credential);

        if (enabledByDefault != null && !enabledByDefault.isEmpty()) {
            writeFlags(frame, enabledByDefault, Collections.nCopies(enabledByDefault.size(), Boolean.TRUE));
        }

        log.info("INTEGRATION: {} registered with {} selector(s) enabled",
                self, enabledByDefault == null ? 0 : enabledByDefault.size());
        return true;
    }

    // ========================================================================
    // FUNCTION PROTECTION
    // ========================================================================

    public void setFunctionProtectionStatus(CallFrame<S> frame, List<Selector> selectors, List<Boolean> flags) {
        checkIdentity(frame);
        frame.storage().administration().requireAdmin(frame.caller());
        if (selectors.size() != flags.size()) {
            throw new ProtocolException(ProtocolError.ARRAY_LENGTH_MISMATCH);
        }
        if (selectors.contains(null) || flags.contains(null)) {
            throw new ProtocolException(ProtocolError.INVALID_FLAG);
        }

        writeFlags(frame, selectors, flags);
    }

    public boolean isFunctionProtectionEnabled(CallFrame<S> frame, Selector selector) {
        checkIdentity(frame);
        return readFlag(frame, selector);
    }

    // ========================================================================
    // SECURITY ADMINISTRATION
    // ========================================================================

    public void transferSecurityAdministration(CallFrame<S> frame, Address newAdmin) {
        checkIdentity(frame);
        eventPublisher.publishEvent(
                frame.storage().administration().transferAdministration(frame.target(), frame.caller(), newAdmin));
        log.info("INTEGRATION: Security admin transfer of {} started, pending {}", frame.target(), newAdmin);
    }

    public void acceptSecurityAdministration(CallFrame<S> frame) {
        checkIdentity(frame);
        eventPublisher.publishEvent(
                frame.storage().administration().acceptAdministration(frame.target(), frame.caller()));
        log.info("INTEGRATION: {} is now security admin of {}", frame.caller(), frame.target());
    }

    public Address securityAdmin(CallFrame<S> frame) {
        return frame.storage().administration().getAdmin();
    }

    public Address pendingSecurityAdmin(CallFrame<S> frame) {
        return frame.storage().administration().getPendingAdmin();
    }
}
