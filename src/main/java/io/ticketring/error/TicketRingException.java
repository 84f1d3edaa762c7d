package io.ticketring.error;

import io.ticketring.model.Slot;

public class TicketRingException extends RuntimeException {
    private final ErrorCode code;
    private final Slot slot;

    public TicketRingException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public TicketRingException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    private TicketRingException(ErrorCode code, String message, Slot slot, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.slot = slot;
    }

    public static TicketRingException corruptSlot(Slot slot, String keyId, String detail, Throwable cause) {
        String message = "Ring " + keyId + " has invalid key in slot " + slot.documentName()
                + " (" + slot.role() + "): " + detail;
        return new TicketRingException(ErrorCode.CORRUPT_RING_STATE, message, slot, cause);
    }

    public static TicketRingException invalidArgument(String message) {
        return new TicketRingException(ErrorCode.INVALID_ARGUMENT, message);
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * Offending slot for {@link ErrorCode#CORRUPT_RING_STATE}; {@code null} for every other code.
     */
    public Slot slot() {
        return slot;
    }
}
