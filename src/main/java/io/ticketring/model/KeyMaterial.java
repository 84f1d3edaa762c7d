package io.ticketring.model;

import io.ticketring.util.Hashing;

/**
 * Base64 text of a ticket key as it appears in seed files, cache documents and runtime commands.
 *
 * <p>Holding a {@code KeyMaterial} says nothing about validity; see {@code KeyMaterialCodec#validate}.
 * {@link #toString()} prints a fingerprint, never the secret.
 */
public record KeyMaterial(String value) {
    private static final int FINGERPRINT_CHARS = 12;

    public KeyMaterial {
        value = value == null ? "" : value.strip();
    }

    public static KeyMaterial of(String value) {
        return new KeyMaterial(value);
    }

    public String fingerprint() {
        return Hashing.sha256Hex(value).substring(0, FINGERPRINT_CHARS);
    }

    @Override
    public String toString() {
        return "KeyMaterial[sha256:" + fingerprint() + "]";
    }
}
