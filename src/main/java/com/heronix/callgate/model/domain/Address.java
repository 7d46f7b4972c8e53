package com.heronix.callgate.model.domain;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte identity of a protocol participant (router, gatekeeper, logic unit, proxy or user).
 *
 * Rendered as {@code 0x} followed by 40 lowercase hex characters.
 */
public record Address(String value) {

    public static final int LENGTH = 20;

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    public Address {
        if (value == null) {
            throw new IllegalArgumentException("Address value is required");
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address requires exactly " + LENGTH + " bytes");
        }
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    /**
     * Fresh address for a newly deployed component.
     */
    public static Address random() {
        byte[] bytes = new byte[LENGTH];
        RANDOM.nextBytes(bytes);
        return fromBytes(bytes);
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    /**
     * Shortened form for log lines.
     */
    public String abbreviated() {
        return value.substring(0, 8) + ".." + value.substring(value.length() - 4);
    }

    @Override
    public String toString() {
        return value;
    }
}
