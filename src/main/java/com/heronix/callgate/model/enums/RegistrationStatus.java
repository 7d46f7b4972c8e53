package com.heronix.callgate.model.enums;

/**
 * Registration state of an integration identity in the GateKeeper ledger.
 *
 * Moves {@code UNREGISTERED -> PENDING -> REGISTERED}; any other move is an administrator override.
 */
public enum RegistrationStatus {

    /**
     * Never seen by the ledger
     */
    UNREGISTERED,

    /**
     * Pre-registered at construction or initialization, waiting for a registrar credential
     */
    PENDING,

    /**
     * Registration completed through the router with a valid credential
     */
    REGISTERED
}
