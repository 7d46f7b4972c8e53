package com.heronix.callgate.integration;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import com.heronix.callgate.model.domain.Address;

/**
 * Token balances of the demo mint.
 */
public class DemoMintStorage extends IntegrationStorage {

    private final Map<Address, BigInteger> balances = new HashMap<>();

    public BigInteger balanceOf(Address owner) {
        return balances.getOrDefault(owner, BigInteger.ZERO);
    }

    void credit(Address owner, BigInteger amount) {
        balances.merge(owner, amount, BigInteger::add);
    }

    @Override
    protected Object captureState() {
        return Map.copyOf(balances);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void restoreState(Object state) {
        balances.clear();
        balances.putAll((Map<Address, BigInteger>) state);
    }
}
