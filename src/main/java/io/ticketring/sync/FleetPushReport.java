package io.ticketring.sync;

import java.util.List;

public record FleetPushReport(
        String keyId,
        String keyFingerprint,
        List<InstanceResult> results
) {
    public FleetPushReport {
        results = List.copyOf(results);
    }

    public long delivered() {
        return results.stream().filter(InstanceResult::delivered).count();
    }

    public long failed() {
        return results.size() - delivered();
    }

    public boolean complete() {
        return failed() == 0;
    }
}
