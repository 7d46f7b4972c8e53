package com.heronix.callgate.integration;

import java.util.HashMap;
import java.util.Map;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.Selector;

/**
 * Storage a logic unit executes against.
 *
 * Subclasses add the state of their own operations and take part in rollback through
 * {@link #captureState()} and {@link #restoreState(Object)}.
 */
public class IntegrationStorage {

    private final AdminTransfer administration = new AdminTransfer();
    private final Map<Selector, Boolean> protectionFlags = new HashMap<>();
    private boolean initialized;

    public AdminTransfer administration() {
        return administration;
    }

    public boolean isInitialized() {
        return initialized;
    }

    void markInitialized() {
        this.initialized = true;
    }

    boolean getFlag(Selector selector) {
        return protectionFlags.getOrDefault(selector, Boolean.FALSE);
    }

    void putFlag(Selector selector, boolean enabled) {
        protectionFlags.put(selector, enabled);
    }

    /**
     * State of the subclass, copied deep enough that later writes do not reach it.
     */
    protected Object captureState() {
        return null;
    }

    protected void restoreState(Object state) {
        // no subclass state
    }

    Checkpoint checkpoint() {
        return new Checkpoint(administration.getAdmin(), administration.getPendingAdmin(),
                Map.copyOf(protectionFlags), initialized, captureState());
    }

    void rollback(Checkpoint checkpoint) {
        administration.restore(checkpoint.admin(), checkpoint.pendingAdmin());
        protectionFlags.clear();
        protectionFlags.putAll(checkpoint.protectionFlags());
        initialized = checkpoint.initialized();
        restoreState(checkpoint.extension());
    }

    record Checkpoint(
            Address admin,
            Address pendingAdmin,
            Map<Selector, Boolean> protectionFlags,
            boolean initialized,
            Object extension
    ) {
    }
}
