package com.heronix.callgate.model.domain;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 32-byte identifier of an installed security module.
 *
 * Protected-call payloads carry it at bytes {@code [4, 36)}, right after the module marker.
 */
public record ModuleId(String value) {

    public static final int LENGTH = 32;
    public static final int OFFSET = Selector.LENGTH;

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{64}$");

    public ModuleId {
        if (value == null) {
            throw new IllegalArgumentException("Module id is required");
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid module id: " + value);
        }
    }

    public static ModuleId parse(String hex) {
        return new ModuleId(hex);
    }

    public static ModuleId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Module id requires exactly " + LENGTH + " bytes");
        }
        return new ModuleId("0x" + HexFormat.of().formatHex(bytes));
    }

    /**
     * Read the module id embedded in a protected-call payload.
     */
    public static ModuleId fromPayload(byte[] payload) {
        if (payload == null || payload.length < OFFSET + LENGTH) {
            throw new IllegalArgumentException("Payload too short to carry a module id");
        }
        return fromBytes(Arrays.copyOfRange(payload, OFFSET, OFFSET + LENGTH));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    @Override
    public String toString() {
        return value;
    }
}
