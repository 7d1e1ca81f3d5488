package com.flagship.token_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque 32-byte identity of a party holding tokens.
 *
 * Equality and hashing are by content. No ordering is defined.
 * The text form is 64 lowercase hex characters.
 */
@EqualsAndHashCode
public final class AccountId {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private AccountId(byte[] bytes) {
        this.bytes = bytes;
    }

    public static AccountId of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                String.format("Account id must be %d bytes, got %d", LENGTH, bytes.length));
        }
        return new AccountId(bytes.clone());
    }

    /**
     * Parses the hex form, with or without a {@code 0x} prefix.
     *
     * @throws IllegalArgumentException if the value is not 64 hex characters
     */
    @JsonCreator
    public static AccountId fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Invalid account id: " + hex);
        }
        try {
            return new AccountId(HEX.parseHex(digits));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid account id: " + hex, e);
        }
    }

    /**
     * An id with every byte set to {@code fill}. Handy for fixtures and local tooling.
     */
    public static AccountId filledWith(int fill) {
        byte[] bytes = new byte[LENGTH];
        Arrays.fill(bytes, (byte) fill);
        return new AccountId(bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
