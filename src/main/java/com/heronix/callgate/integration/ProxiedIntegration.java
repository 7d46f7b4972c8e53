package com.heronix.callgate.integration;

import java.util.List;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;

import lombok.extern.slf4j.Slf4j;

/**
 * Logic unit meant to run behind an {@link IntegrationProxy}.
 *
 * Protection flags are kept by the GateKeeper under the self-identity of this logic
 * unit, never in proxy storage, so a replacement logic unit cannot forge them.
 * The admin lives in proxy storage and is set explicitly by {@link #initialize}.
 */
@Slf4j
public abstract class ProxiedIntegration<S extends IntegrationStorage> extends Integration<S> {

    protected ProxiedIntegration(Address self, IntegrationEnvironment environment) {
        super(self, environment);
        getGateKeeper().preRegister(self);

        log.info("INTEGRATION: Proxied logic unit {} deployed", self);
    }

    /**
     * One-time initialization of the proxy storage.
     *
     * @param admin security admin of the proxied integration; there is no implicit default
     */
    public void initialize(CallFrame<S> frame, Address admin) {
        checkIdentity(frame);
        if (frame.storage().isInitialized()) {
            throw new ProtocolException(ProtocolError.ALREADY_INITIALIZED);
        }

        frame.storage().administration().initialize(admin);
        frame.storage().markInitialized();
        getGateKeeper().preRegister(frame.target());

        log.info("INTEGRATION: Proxy {} initialized with logic {} and admin {}", frame.target(), getSelf(), admin);
    }

    /**
     * Name the logic unit allowed to replace this one. Security admin only.
     *
     * The proxy upgrade to that unit then hands this unit's registration over to it.
     */
    public void preAuthorizeNewImplementation(CallFrame<S> frame, Address newImplementation) {
        checkIdentity(frame);
        frame.storage().administration().requireAdmin(frame.caller());

        getGateKeeper().preAuthorizeUpgrade(getSelf(), getSelf(), newImplementation);
    }

    @Override
    protected void checkIdentity(CallFrame<S> frame) {
        if (getSelf().equals(frame.target())) {
            log.warn("INTEGRATION: Direct call to proxied logic unit {} rejected", getSelf());
            throw new ProtocolException(ProtocolError.DIRECT_CALL_NOT_PERMITTED);
        }
    }

    @Override
    protected boolean readFlag(CallFrame<S> frame, Selector selector) {
        return getGateKeeper().queryFlag(getSelf(), selector);
    }

    @Override
    protected void writeFlags(CallFrame<S> frame, List<Selector> selectors, List<Boolean> flags) {
        getGateKeeper().updateFlags(getSelf(), getSelf(), selectors, flags);
    }
}
