package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.TicketRingException;
import io.ticketring.model.KeyMaterial;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fans runtime commands out across a fleet on a bounded pool. Instances are handled independently;
 * one slow or failing instance never aborts the others.
 */
public final class FleetPushCoordinator implements AutoCloseable {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final RuntimeSyncClient client;
    private final int maxAttempts;
    private final ExecutorService pool;

    public FleetPushCoordinator(RuntimeSyncClient client, int parallelism, int maxAttempts) {
        this.client = client;
        this.maxAttempts = Math.max(1, maxAttempts);
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread thread = new Thread(r, "ticketring-push-" + poolId + "-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public RuntimeSyncClient client() {
        return client;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Starts tracking delivery of one key. Reuse the session to retry without resending to acknowledged instances. */
    public FleetPushSession session(String keyId, KeyMaterial key) {
        if (keyId == null || keyId.isBlank()) {
            throw TicketRingException.invalidArgument("key id is required");
        }
        if (key == null) {
            throw TicketRingException.invalidArgument("key is required");
        }
        return new FleetPushSession(this, keyId, key);
    }

    public FleetPushReport push(String keyId, KeyMaterial key, List<InstanceEndpoint> instances) {
        return session(keyId, key).push(instances);
    }

    <T> Map<InstanceEndpoint, T> forEachInstance(List<InstanceEndpoint> instances,
                                                 Function<InstanceEndpoint, T> call,
                                                 BiFunction<InstanceEndpoint, Throwable, T> onFailure) {
        Map<InstanceEndpoint, Future<T>> futures = new LinkedHashMap<>();
        for (InstanceEndpoint instance : instances) {
            futures.put(instance, pool.submit(() -> call.apply(instance)));
        }
        Map<InstanceEndpoint, T> results = new LinkedHashMap<>();
        for (Map.Entry<InstanceEndpoint, Future<T>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (ExecutionException e) {
                results.put(entry.getKey(), onFailure.apply(entry.getKey(), e.getCause() == null ? e : e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(future -> future.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for fleet responses", e);
            }
        }
        return results;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
