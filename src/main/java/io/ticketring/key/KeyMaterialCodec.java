package io.ticketring.key;

import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.model.KeyMaterial;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encodes, decodes and checks 48-byte TLS session ticket keys.
 *
 * <p>48 bytes is the ticket key layout load balancers expect: 16 bytes of key name, 16 bytes of
 * HMAC secret and 16 bytes of AES key.
 */
public final class KeyMaterialCodec {
    public static final int KEY_BYTES = 48;

    private final SecureRandom secureRandom;

    public KeyMaterialCodec() {
        this(new SecureRandom());
    }

    public KeyMaterialCodec(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public KeyMaterial generate() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return encode(raw);
    }

    public KeyMaterial encode(byte[] raw) {
        if (raw == null || raw.length != KEY_BYTES) {
            int length = raw == null ? 0 : raw.length;
            throw new TicketRingException(ErrorCode.INVALID_KEY_FORMAT,
                    "ticket key must be " + KEY_BYTES + " bytes, got " + length);
        }
        return new KeyMaterial(Base64.getEncoder().encodeToString(raw));
    }

    public byte[] decode(KeyMaterial material) {
        if (material == null || material.value().isEmpty()) {
            throw new TicketRingException(ErrorCode.INVALID_KEY_FORMAT, "ticket key is empty");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(material.value());
        } catch (IllegalArgumentException e) {
            throw new TicketRingException(ErrorCode.INVALID_KEY_FORMAT,
                    "ticket key is not valid base64: " + e.getMessage(), e);
        }
        if (raw.length != KEY_BYTES) {
            throw new TicketRingException(ErrorCode.INVALID_KEY_FORMAT,
                    "ticket key decoded to " + raw.length + " bytes, expected " + KEY_BYTES);
        }
        return raw;
    }

    public KeyMaterial validate(KeyMaterial material) {
        decode(material);
        return material;
    }

    public KeyMaterial validate(String material) {
        return validate(new KeyMaterial(material));
    }

    public boolean isValid(KeyMaterial material) {
        try {
            decode(material);
            return true;
        } catch (TicketRingException e) {
            return false;
        }
    }
}
