package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.model.KeyRing;
import io.ticketring.model.RuntimeKeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares the persisted ring with what each live instance holds, and on request brings lagging
 * instances forward. Persisted state and runtime state are only ever joined here.
 */
public final class FleetReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FleetReconciler.class);

    private final FleetPushCoordinator coordinator;

    public FleetReconciler(FleetPushCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public List<DriftEntry> inspect(KeyRing ring, List<InstanceEndpoint> instances) {
        Map<InstanceEndpoint, DriftEntry> results = coordinator.forEachInstance(
                instances,
                instance -> compare(ring, instance),
                (instance, failure) -> new DriftEntry(instance.name(), DriftEntry.Status.UNREACHABLE, String.valueOf(failure))
        );
        return new ArrayList<>(results.values());
    }

    /**
     * Pushes the ring's newest key to every instance that does not hold it. Instances that hold it
     * in an older slot are reported but left alone: pushing again would admit the key twice.
     */
    public ReconcileReport reconcile(KeyRing ring, List<InstanceEndpoint> instances) {
        List<DriftEntry> drift = inspect(ring, instances);
        List<InstanceEndpoint> behind = new ArrayList<>();
        for (InstanceEndpoint instance : instances) {
            drift.stream()
                    .filter(entry -> entry.instance().equals(instance.name()) && entry.status() == DriftEntry.Status.BEHIND)
                    .findFirst()
                    .ifPresent(entry -> behind.add(instance));
        }
        if (behind.isEmpty()) {
            LOGGER.info("No instance is behind ring {}", ring.keyId());
            return new ReconcileReport(drift, null);
        }
        FleetPushReport push = coordinator.session(ring.keyId(), ring.newest()).push(behind);
        return new ReconcileReport(drift, push);
    }

    private DriftEntry compare(KeyRing ring, InstanceEndpoint instance) {
        RuntimeKeySet window;
        try {
            window = coordinator.client().listOne(instance, ring.keyId());
        } catch (TicketRingException e) {
            DriftEntry.Status status = e.code() == ErrorCode.NOT_TRACKED
                    ? DriftEntry.Status.NOT_TRACKED
                    : DriftEntry.Status.UNREACHABLE;
            return new DriftEntry(instance.name(), status, e.getMessage());
        }
        if (window.next().equals(ring.newest())) {
            return new DriftEntry(instance.name(), DriftEntry.Status.IN_SYNC, "next matches newest " + ring.newest().fingerprint());
        }
        if (window.holds(ring.newest())) {
            return new DriftEntry(instance.name(), DriftEntry.Status.DIVERGED,
                    "newest " + ring.newest().fingerprint() + " held, next is " + window.next().fingerprint());
        }
        return new DriftEntry(instance.name(), DriftEntry.Status.BEHIND,
                "newest " + ring.newest().fingerprint() + " missing, next is " + window.next().fingerprint());
    }
}
