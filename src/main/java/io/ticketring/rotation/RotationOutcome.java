package io.ticketring.rotation;

import io.ticketring.model.KeyMaterial;
import io.ticketring.model.KeyRing;

import java.time.Duration;

/**
 * Result of a rotation attempt that did not fail.
 *
 * @param ring       the rotated ring for {@link Status#ROTATED}; the unchanged input ring for {@link Status#TOO_SOON}
 * @param admitted   key placed in the newest slot; {@code null} when not rotated
 * @param evicted    former oldest key, dropped from the ring and never reused; {@code null} when not rotated
 * @param retryAfter time left before the cooldown elapses; {@link Duration#ZERO} when rotated
 */
public record RotationOutcome(
        Status status,
        KeyRing ring,
        KeyMaterial admitted,
        KeyMaterial evicted,
        Duration retryAfter
) {
    public enum Status {
        ROTATED,
        TOO_SOON
    }

    public static RotationOutcome rotated(KeyRing ring, KeyMaterial evicted) {
        return new RotationOutcome(Status.ROTATED, ring, ring.newest(), evicted, Duration.ZERO);
    }

    public static RotationOutcome tooSoon(KeyRing unchanged, Duration retryAfter) {
        return new RotationOutcome(Status.TOO_SOON, unchanged, null, null, retryAfter);
    }

    public boolean rotated() {
        return status == Status.ROTATED;
    }
}
