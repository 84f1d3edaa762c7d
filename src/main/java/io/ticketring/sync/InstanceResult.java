package io.ticketring.sync;

/**
 * Per-instance outcome of a fleet push.
 *
 * @param attempts number of times a key insert was actually sent to the instance
 */
public record InstanceResult(
        String instance,
        String address,
        Status status,
        int attempts,
        String detail
) {
    public enum Status {
        ACCEPTED,
        ALREADY_PRESENT,
        REJECTED,
        NOT_TRACKED,
        TIMEOUT,
        CHANNEL_ERROR,
        FAILED;

        public boolean delivered() {
            return this == ACCEPTED || this == ALREADY_PRESENT;
        }

        /** Transport failures leave the instance in an unknown state and are worth another attempt. */
        public boolean retryable() {
            return this == TIMEOUT || this == CHANNEL_ERROR;
        }
    }

    public boolean delivered() {
        return status.delivered();
    }
}
