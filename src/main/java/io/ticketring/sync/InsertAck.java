package io.ticketring.sync;

/** Positive answer to a key insert. Only returned when the instance accepted the key. */
public record InsertAck(String instance, String keyId, String keyFingerprint, String response) {
}
