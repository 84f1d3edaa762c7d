package io.ticketring.error;

/**
 * Failure categories raised by the key store, the rotation engine and the runtime command channel.
 *
 * <p>A rotation refused because the cooldown has not elapsed is not a failure and has no code here;
 * see {@code io.ticketring.rotation.RotationOutcome.Status#TOO_SOON}.
 */
public enum ErrorCode {
    INVALID_ARGUMENT,
    INVALID_KEY_FORMAT,
    KEY_ID_NOT_FOUND,
    CACHE_UNAVAILABLE,
    CACHE_CORRUPT,
    CORRUPT_RING_STATE,
    PERSISTENCE_ERROR,
    CHANNEL_TIMEOUT,
    CHANNEL_ERROR,
    REJECTED_BY_INSTANCE,
    NOT_TRACKED,
    SEED_FORMAT_ERROR
}
