package com.heronix.callgate.model.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 4-byte operation identifier used as the key of a protection flag.
 *
 * Derived from an operation signature as the first four bytes of its SHA-256 digest,
 * e.g. {@code Selector.of("safeMint(uint256,bytes)")}.
 */
public record Selector(String value) {

    public static final int LENGTH = 4;

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{8}$");

    public Selector {
        if (value == null) {
            throw new IllegalArgumentException("Selector value is required");
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid selector: " + value);
        }
    }

    /**
     * Derive the selector of an operation signature.
     */
    public static Selector of(String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("Operation signature is required");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(signature.getBytes(StandardCharsets.UTF_8));
            return fromBytes(Arrays.copyOf(digest, LENGTH));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static Selector parse(String hex) {
        return new Selector(hex);
    }

    public static Selector fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Selector requires exactly " + LENGTH + " bytes");
        }
        return new Selector("0x" + HexFormat.of().formatHex(bytes));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    @Override
    public String toString() {
        return value;
    }
}
