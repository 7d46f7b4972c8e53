package com.heronix.callgate.integration;

import java.math.BigInteger;

import com.heronix.callgate.model.domain.Address;

/**
 * One executing invocation of a logic unit.
 *
 * @param caller  who invoked the operation
 * @param target  address the call was addressed to; owner of {@code storage}
 * @param value   value attached to the request
 * @param data    full invocation data
 * @param storage storage the logic unit executes against
 */
public record CallFrame<S extends IntegrationStorage>(
        Address caller,
        Address target,
        BigInteger value,
        byte[] data,
        S storage
) {
    public CallFrame {
        value = value != null ? value : BigInteger.ZERO;
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Attached value must not be negative");
        }
        data = data != null ? data.clone() : new byte[0];
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
