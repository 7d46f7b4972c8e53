package com.heronix.callgate.integration;

import java.math.BigInteger;
import java.util.List;
import java.util.function.Function;

import org.springframework.transaction.support.TransactionOperations;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;
import com.heronix.callgate.model.event.ProtocolEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Logic unit that hosts itself. Its storage, admin and protection flags are its own
 * and it refuses to run against anyone else's storage.
 */
@Slf4j
public abstract class StandaloneIntegration<S extends IntegrationStorage> extends Integration<S> {

    private final S storage;
    private final TransactionOperations transactionOperations;

    protected StandaloneIntegration(Address self, Address deployer, S storage, IntegrationEnvironment environment) {
        super(self, environment);
        this.storage = storage;
        this.transactionOperations = environment.getTransactionOperations();

        storage.administration().initialize(deployer);
        storage.markInitialized();
        getGateKeeper().preRegister(self);

        log.info("INTEGRATION: Standalone integration {} deployed by {}", self, deployer);
    }

    /**
     * Invoke an operation of this integration as {@code caller}.
     */
    public synchronized <R> R call(Address caller, BigInteger value, byte[] data, Function<CallFrame<S>, R> operation) {
        CallFrame<S> frame = new CallFrame<>(caller, getSelf(), value, data, storage);
        return UnitOfWork.execute(transactionOperations, storage, () -> operation.apply(frame));
    }

    /**
     * Read storage without a unit of work.
     */
    public synchronized <R> R view(Function<S, R> reader) {
        return reader.apply(storage);
    }

    @Override
    protected void checkIdentity(CallFrame<S> frame) {
        if (!getSelf().equals(frame.target())) {
            log.warn("INTEGRATION: {} invoked through {} - delegation rejected", getSelf(), frame.target());
            throw new ProtocolException(ProtocolError.DELEGATION_NOT_PERMITTED);
        }
    }

    @Override
    protected boolean readFlag(CallFrame<S> frame, Selector selector) {
        return frame.storage().getFlag(selector);
    }

    @Override
    protected void writeFlags(CallFrame<S> frame, List<Selector> selectors, List<Boolean> flags) {
        for (int i = 0; i < selectors.size(); i++) {
            frame.storage().putFlag(selectors.get(i), flags.get(i));
        }
        getEventPublisher().publishEvent(
                new ProtocolEvent.FunctionProtectionStatusUpdated(getSelf(), selectors, flags));

        log.info("INTEGRATION: Updated {} protection flag(s) of {}", selectors.size(), getSelf());
    }
}
