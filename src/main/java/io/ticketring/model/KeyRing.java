package io.ticketring.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Authoritative three-slot rotation history for one key id within one region.
 * Slots are ordered from least to most recently admitted.
 */
public record KeyRing(
        String keyId,
        Instant lastRotation,
        KeyMaterial oldest,
        KeyMaterial current,
        KeyMaterial newest
) {
    public KeyRing {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("key id cannot be empty");
        }
        Objects.requireNonNull(lastRotation, "lastRotation");
        Objects.requireNonNull(oldest, "oldest");
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(newest, "newest");
    }

    public static KeyRing of(String keyId, Instant lastRotation, List<KeyMaterial> slots) {
        if (slots == null || slots.size() != 3) {
            throw new IllegalArgumentException("a key ring holds exactly 3 keys, got "
                    + (slots == null ? 0 : slots.size()));
        }
        return new KeyRing(keyId, lastRotation, slots.get(0), slots.get(1), slots.get(2));
    }

    public KeyMaterial slot(Slot slot) {
        return switch (slot) {
            case OLDEST -> oldest;
            case CURRENT -> current;
            case NEWEST -> newest;
        };
    }

    public List<KeyMaterial> slots() {
        return List.of(oldest, current, newest);
    }

    /** Drops {@link #oldest()} and admits {@code admitted} as the new newest slot. */
    public KeyRing shift(KeyMaterial admitted, Instant rotatedAt) {
        return new KeyRing(keyId, rotatedAt, current, newest, admitted);
    }
}
