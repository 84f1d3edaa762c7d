package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.TicketRingException;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.RuntimeKeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery of one key to a set of instances, at most once per instance.
 *
 * <p>Instances that acknowledged are remembered and skipped by every later {@link #push} on this
 * session. Before the first insert to an instance, and before resending after a timed out insert
 * that may still have been applied, the session reads the instance's window and counts the key as
 * delivered if it is already there. A push repeated in a new session therefore does not age the
 * window of instances that already hold the key.
 */
public final class FleetPushSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(FleetPushSession.class);

    private final FleetPushCoordinator coordinator;
    private final String keyId;
    private final KeyMaterial key;
    private final Set<String> acknowledged = ConcurrentHashMap.newKeySet();
    private final Set<String> uncertain = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> sends = new ConcurrentHashMap<>();
    private final Map<String, InstanceResult> latest = new ConcurrentHashMap<>();

    FleetPushSession(FleetPushCoordinator coordinator, String keyId, KeyMaterial key) {
        this.coordinator = coordinator;
        this.keyId = keyId;
        this.key = key;
    }

    public String keyId() {
        return keyId;
    }

    public Set<String> acknowledged() {
        return Collections.unmodifiableSet(acknowledged);
    }

    /**
     * Pushes the key to every listed instance that has not acknowledged it yet, retrying transport
     * failures up to the coordinator's attempt limit.
     */
    public synchronized FleetPushReport push(List<InstanceEndpoint> instances) {
        Map<String, InstanceEndpoint> byName = new LinkedHashMap<>();
        for (InstanceEndpoint instance : instances) {
            byName.putIfAbsent(instance.name(), instance);
        }
        List<InstanceEndpoint> pending = new ArrayList<>();
        for (InstanceEndpoint instance : byName.values()) {
            if (!acknowledged.contains(instance.name())) {
                pending.add(instance);
            }
        }
        for (int round = 1; round <= coordinator.maxAttempts() && !pending.isEmpty(); round++) {
            Map<InstanceEndpoint, InstanceResult> results = coordinator.forEachInstance(
                    pending,
                    this::deliver,
                    (instance, failure) -> result(instance, InstanceResult.Status.FAILED, String.valueOf(failure))
            );
            List<InstanceEndpoint> retry = new ArrayList<>();
            for (Map.Entry<InstanceEndpoint, InstanceResult> entry : results.entrySet()) {
                InstanceEndpoint instance = entry.getKey();
                InstanceResult result = entry.getValue();
                latest.put(instance.name(), result);
                if (result.delivered()) {
                    acknowledged.add(instance.name());
                } else if (result.status().retryable()) {
                    retry.add(instance);
                }
            }
            if (!retry.isEmpty() && round < coordinator.maxAttempts()) {
                LOGGER.info("Retrying key {} for {} on {} instance(s) after round {}",
                        key.fingerprint(), keyId, retry.size(), round);
            }
            pending = retry;
        }
        List<InstanceResult> ordered = new ArrayList<>();
        for (String name : byName.keySet()) {
            ordered.add(latest.get(name));
        }
        FleetPushReport report = new FleetPushReport(keyId, key.fingerprint(), ordered);
        LOGGER.info("Pushed key {} for {}: {}/{} instance(s) hold it",
                key.fingerprint(), keyId, report.delivered(), ordered.size());
        return report;
    }

    private InstanceResult deliver(InstanceEndpoint instance) {
        boolean firstSend = !sends.containsKey(instance.name());
        if (firstSend || uncertain.contains(instance.name())) {
            try {
                RuntimeKeySet window = coordinator.client().listOne(instance, keyId);
                if (window.holds(key)) {
                    uncertain.remove(instance.name());
                    return result(instance, InstanceResult.Status.ALREADY_PRESENT, firstSend
                            ? "key already in runtime window"
                            : "key found in runtime window after an unconfirmed insert");
                }
            } catch (TicketRingException e) {
                return failure(instance, e);
            }
        }
        try {
            sends.merge(instance.name(), 1, Integer::sum);
            InsertAck ack = coordinator.client().insert(instance, keyId, key);
            uncertain.remove(instance.name());
            return result(instance, InstanceResult.Status.ACCEPTED, ack.response());
        } catch (TicketRingException e) {
            return failure(instance, e);
        } catch (RuntimeException e) {
            uncertain.add(instance.name());
            LOGGER.warn("Unexpected failure pushing {} to {}", keyId, instance.name(), e);
            return result(instance, InstanceResult.Status.FAILED, e.toString());
        }
    }

    private InstanceResult failure(InstanceEndpoint instance, TicketRingException e) {
        InstanceResult.Status status = switch (e.code()) {
            case CHANNEL_TIMEOUT -> InstanceResult.Status.TIMEOUT;
            case CHANNEL_ERROR -> InstanceResult.Status.CHANNEL_ERROR;
            case REJECTED_BY_INSTANCE -> InstanceResult.Status.REJECTED;
            case NOT_TRACKED -> InstanceResult.Status.NOT_TRACKED;
            default -> InstanceResult.Status.FAILED;
        };
        if (status.retryable()) {
            uncertain.add(instance.name());
        }
        LOGGER.warn("Push of {} to {} failed: {} {}", keyId, instance.name(), e.code(), e.getMessage());
        return result(instance, status, e.getMessage());
    }

    private InstanceResult result(InstanceEndpoint instance, InstanceResult.Status status, String detail) {
        return new InstanceResult(instance.name(), instance.address(), status,
                sends.getOrDefault(instance.name(), 0), detail);
    }
}
