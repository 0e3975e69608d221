package com.podium.domain.account;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * 32-byte account or object address, rendered as {@code 0x} + 64 lowercase hex digits.
 * Short forms such as {@code 0x1} are left-padded with zeros.
 */
public record Address(String value) implements Comparable<Address> {

    public static final int LENGTH = 32;
    private static final int HEX_DIGITS = LENGTH * 2;

    public Address {
        Objects.requireNonNull(value, "value");
        value = normalize(value);
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public static Address of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    public byte[] bytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    /** Short form used in logs and pass symbols. */
    public String shortHex() {
        return value.substring(0, 10);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

    private static String normalize(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("@")) s = s.substring(1);
        if (s.startsWith("0x")) s = s.substring(2);
        if (s.isEmpty()) throw new IllegalArgumentException("Address is blank");
        if (s.length() > HEX_DIGITS) {
            throw new IllegalArgumentException("Address longer than " + HEX_DIGITS + " hex digits: " + raw);
        }
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("Address is not hex: " + raw);
            }
        }
        return "0x" + "0".repeat(HEX_DIGITS - s.length()) + s;
    }
}
