package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;

/**
 * Request/response transport to a running instance's runtime command interface.
 *
 * <p>Implementations report transport problems only: {@code CHANNEL_TIMEOUT} when the exchange did
 * not finish in time, {@code CHANNEL_ERROR} for any other transport failure. Whatever text the
 * instance answers with is returned as-is and interpreted by {@link RuntimeSyncClient}.
 */
public interface CommandChannel {
    String execute(InstanceEndpoint instance, String command);
}
