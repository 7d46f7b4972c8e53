package com.heronix.callgate.router;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

import com.heronix.callgate.model.domain.Address;
import com.heronix.callgate.model.domain.ModuleId;

/**
 * A guarded invocation handed to the router for a permit/deny decision.
 *
 * @param caller         who invoked the guarded operation
 * @param integration    self-identity of the logic unit executing the operation
 * @param value          value attached to the request
 * @param payloadLength  length of the security payload
 * @param invocationData full invocation data of the guarded operation
 * @param payload        security payload supplied by the caller
 */
public record ProtectedCall(
        Address caller,
        Address integration,
        BigInteger value,
        int payloadLength,
        byte[] invocationData,
        byte[] payload
) {
    public ProtectedCall {
        value = value != null ? value : BigInteger.ZERO;
        invocationData = invocationData != null ? invocationData.clone() : new byte[0];
        payload = payload != null ? payload.clone() : new byte[0];
    }

    /**
     * Module the payload is addressed to.
     */
    public ModuleId moduleId() {
        return ModuleId.fromPayload(payload);
    }

    public byte[] moduleMarker() {
        return Arrays.copyOf(payload, ModuleId.OFFSET);
    }

    public String invocationDataHex() {
        return "0x" + HexFormat.of().formatHex(invocationData);
    }

    public String payloadHex() {
        return "0x" + HexFormat.of().formatHex(payload);
    }

    @Override
    public byte[] invocationData() {
        return invocationData.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProtectedCall other)) {
            return false;
        }
        return payloadLength == other.payloadLength
                && caller.equals(other.caller)
                && integration.equals(other.integration)
                && value.equals(other.value)
                && Arrays.equals(invocationData, other.invocationData)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(caller, integration, value, payloadLength);
        result = 31 * result + Arrays.hashCode(invocationData);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ProtectedCall[caller=" + caller + ", integration=" + integration + ", value=" + value
                + ", payloadLength=" + payloadLength + ", invocationData=" + invocationDataHex() + "]";
    }
}
