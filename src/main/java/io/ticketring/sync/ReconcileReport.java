package io.ticketring.sync;

import java.util.List;

/**
 * @param push delivery of the ring's newest key to the instances found {@code BEHIND}; {@code null}
 *             when no instance needed it
 */
public record ReconcileReport(List<DriftEntry> drift, FleetPushReport push) {
    public ReconcileReport {
        drift = List.copyOf(drift);
    }
}
