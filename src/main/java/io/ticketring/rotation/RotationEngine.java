package io.ticketring.rotation;

import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.KeyRing;
import io.ticketring.model.Slot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-gated rotation of a three-slot key ring.
 *
 * <p>A successful rotation drops the oldest key, moves current and newest down one slot, and admits
 * the candidate as newest. After three rotations with candidates k1, k2, k3 the ring is exactly
 * {k1, k2, k3} whatever it held before.
 *
 * <p>The engine never touches storage; {@link RegionRotationService} wraps it with locking and
 * persistence.
 */
public final class RotationEngine {
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofHours(12);

    private final KeyMaterialCodec codec;
    private final Clock clock;
    private final Duration minInterval;

    public RotationEngine(KeyMaterialCodec codec, Clock clock) {
        this(codec, clock, DEFAULT_MIN_INTERVAL);
    }

    public RotationEngine(KeyMaterialCodec codec, Clock clock, Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minimum rotation interval must be zero or positive");
        }
        this.codec = codec;
        this.clock = clock;
        this.minInterval = minInterval;
    }

    public Duration minInterval() {
        return minInterval;
    }

    public RotationOutcome rotate(KeyRing ring, KeyMaterial candidate) {
        return rotate(ring, candidate, minInterval, clock.instant());
    }

    /**
     * @param candidate key to admit; a fresh random key is generated when {@code null}
     * @throws TicketRingException {@code INVALID_KEY_FORMAT} for a bad candidate,
     *                             {@code CORRUPT_RING_STATE} when a stored slot does not hold a valid key
     */
    public RotationOutcome rotate(KeyRing ring, KeyMaterial candidate, Duration minInterval, Instant now) {
        if (ring == null) {
            throw TicketRingException.invalidArgument("key ring is required");
        }
        KeyMaterial admitted = candidate == null ? codec.generate() : codec.validate(candidate);

        Duration elapsed = Duration.between(ring.lastRotation(), now);
        if (elapsed.compareTo(minInterval) < 0) {
            return RotationOutcome.tooSoon(ring, minInterval.minus(elapsed));
        }

        for (Slot slot : Slot.values()) {
            checkSlot(ring, slot);
        }
        KeyRing rotated = ring.shift(admitted, now);
        return RotationOutcome.rotated(rotated, ring.oldest());
    }

    private void checkSlot(KeyRing ring, Slot slot) {
        try {
            codec.decode(ring.slot(slot));
        } catch (TicketRingException e) {
            throw TicketRingException.corruptSlot(slot, ring.keyId(), e.getMessage(), e);
        }
    }
}
