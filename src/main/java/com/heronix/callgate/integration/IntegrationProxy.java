package com.heronix.callgate.integration;

import java.math.BigInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionOperations;

import com.heronix.callgate.exception.ProtocolError;
import com.heronix.callgate.exception.ProtocolException;
import com.heronix.callgate.gatekeeper.GateKeeper;
import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.enums.RegistrationStatus;
import com.heronix.callgate.model.event.ProtocolEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Front with its own address and storage that runs a swappable logic unit.
 *
 * Upgrading replaces the logic unit and keeps the storage. The security admin in
 * proxy storage is the only party allowed to upgrade.
 */
@Slf4j
public class IntegrationProxy<S extends IntegrationStorage, L extends Integration<S>> {

    private final Address address;
    private final S storage;
    private final TransactionOperations transactionOperations;
    private final ApplicationEventPublisher eventPublisher;
    private final GateKeeper gateKeeper;
    private L logic;

    public IntegrationProxy(Address address, S storage, L logic, IntegrationEnvironment environment) {
        this.address = address;
        this.storage = storage;
        this.logic = logic;
        this.transactionOperations = environment.getTransactionOperations();
        this.eventPublisher = environment.getEventPublisher();
        this.gateKeeper = environment.getGateKeeper();

        log.info("INTEGRATION: Proxy {} fronting logic unit {}", address, logic.getSelf());
    }

    public Address getAddress() {
        return address;
    }

    public synchronized L getLogic() {
        return logic;
    }

    /**
     * Invoke an operation of the current logic unit against proxy storage as {@code caller}.
     */
    public synchronized <R> R call(Address caller, BigInteger value, byte[] data,
                                   BiFunction<L, CallFrame<S>, R> operation) {
        CallFrame<S> frame = new CallFrame<>(caller, address, value, data, storage);
        L current = logic;
        return UnitOfWork.execute(transactionOperations, storage, () -> operation.apply(current, frame));
    }

    public synchronized <R> R view(Function<S, R> reader) {
        return reader.apply(storage);
    }

    /**
     * Swap the logic unit. Security admin only.
     *
     * A registered logic unit can only be replaced by the successor it pre-authorized;
     * the successor takes over its registration in the same unit of work.
     */
    public synchronized void upgradeTo(Address caller, L newLogic) {
        UnitOfWork.execute(transactionOperations, storage, () -> {
            storage.administration().requireAdmin(caller);
            Address current = logic.getSelf();
            if (newLogic.getSelf().equals(current)) {
                throw new ProtocolException(ProtocolError.ONLY_DISTINCT_IMPLEMENTATION);
            }
            if (gateKeeper.getRegistrationStatus(current) == RegistrationStatus.REGISTERED) {
                gateKeeper.completeUpgrade(current, current, newLogic.getSelf());
            }

            eventPublisher.publishEvent(
                    new ProtocolEvent.ImplementationUpgraded(address, logic.getSelf(), newLogic.getSelf()));
            log.info("INTEGRATION: Proxy {} upgraded from {} to {}", address, logic.getSelf(), newLogic.getSelf());

            this.logic = newLogic;
            return null;
        });
    }
}
