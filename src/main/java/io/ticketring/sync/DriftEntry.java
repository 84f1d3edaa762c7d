package io.ticketring.sync;

/**
 * How one instance's runtime window compares to the persisted ring.
 */
public record DriftEntry(String instance, Status status, String detail) {
    public enum Status {
        /** The instance's {@code next} key is the ring's newest key. */
        IN_SYNC,
        /** The ring's newest key is nowhere in the instance's window. */
        BEHIND,
        /** The ring's newest key is held, but not as {@code next}; the instance admitted other keys since. */
        DIVERGED,
        NOT_TRACKED,
        UNREACHABLE
    }
}
