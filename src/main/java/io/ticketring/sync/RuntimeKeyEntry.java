package io.ticketring.sync;

/** A key id an instance reports it is tracking, with the instance's own description of it. */
public record RuntimeKeyEntry(String keyId, String description) {
}
