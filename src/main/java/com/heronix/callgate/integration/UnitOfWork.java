package com.heronix.callgate.integration;

import java.util.function.Supplier;

import org.springframework.transaction.support.TransactionOperations;

/**
 * Runs one host invocation all-or-nothing: ledger writes roll back with the
 * transaction and host storage is restored from a checkpoint.
 */
final class UnitOfWork {

    private UnitOfWork() {
    }

    static <R> R execute(TransactionOperations transactionOperations, IntegrationStorage storage, Supplier<R> work) {
        IntegrationStorage.Checkpoint checkpoint = storage.checkpoint();
        try {
            return transactionOperations.execute(status -> work.get());
        } catch (RuntimeException | Error e) {
            storage.rollback(checkpoint);
            throw e;
        }
    }
}
