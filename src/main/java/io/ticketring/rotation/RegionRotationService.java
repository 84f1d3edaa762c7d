package io.ticketring.rotation;

import io.ticketring.config.TicketRingConfig;
import io.ticketring.error.TicketRingException;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.KeyRing;
import io.ticketring.observability.AuditLogger;
import io.ticketring.storage.KeyCache;
import io.ticketring.storage.KeyCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one rotation against a region's persisted key cache: lock, load, rotate, save. The region
 * document is only rewritten when the ring actually rotated.
 */
public final class RegionRotationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionRotationService.class);
    private static final String AUDIT_ACTION = "ticket_key.rotate";

    private final TicketRingConfig config;
    private final KeyCacheStore store;
    private final RotationEngine engine;
    private final Clock clock;
    private final ConcurrentMap<String, AuditLogger> auditLoggers = new ConcurrentHashMap<>();

    public RegionRotationService(TicketRingConfig config, KeyCacheStore store, RotationEngine engine, Clock clock) {
        this.config = config;
        this.store = store;
        this.engine = engine;
        this.clock = clock;
    }

    public RotationOutcome rotate(String region, String keyId, KeyMaterial candidate) {
        return rotate(region, keyId, candidate, null);
    }

    public RotationOutcome rotate(String region, String keyId, KeyMaterial candidate, String actor) {
        if (region == null || region.isBlank()) {
            throw TicketRingException.invalidArgument("region is required");
        }
        if (keyId == null || keyId.isBlank()) {
            throw TicketRingException.invalidArgument("key id is required");
        }
        AtomicBoolean audited = new AtomicBoolean(false);
        try {
            return store.withRegionLock(region, () -> {
                try {
                    KeyCache cache = store.load(region);
                    KeyRing ring = store.getRing(cache, keyId);
                    RotationOutcome result = engine.rotate(ring, candidate);
                    if (result.rotated()) {
                        store.save(region, cache.withRing(result.ring()));
                    }
                    logOutcome(region, keyId, result);
                    audit(region, keyId, actor, result.rotated() ? "rotated" : "too_soon", details(result));
                    return result;
                } catch (TicketRingException e) {
                    auditFailure(region, keyId, actor, e);
                    audited.set(true);
                    throw e;
                }
            });
        } catch (TicketRingException e) {
            if (!audited.get()) {
                auditFailure(region, keyId, actor, e);
            }
            throw e;
        }
    }

    private void auditFailure(String region, String keyId, String actor, TicketRingException e) {
        LOGGER.warn("Rotation of {} in region {} failed: {} {}", keyId, region, e.code(), e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_code", e.code().name());
        details.put("error", e.getMessage());
        if (e.slot() != null) {
            details.put("slot", e.slot().documentName());
        }
        audit(region, keyId, actor, "failed", details);
    }

    private void logOutcome(String region, String keyId, RotationOutcome outcome) {
        if (outcome.rotated()) {
            LOGGER.info("Rotated {} in region {}: admitted {} evicted {}",
                    keyId, region, outcome.admitted().fingerprint(), outcome.evicted().fingerprint());
        } else {
            LOGGER.info("Rotation of {} in region {} skipped, cooldown has {} left",
                    keyId, region, outcome.retryAfter());
        }
    }

    private static Map<String, Object> details(RotationOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("last_rotation", outcome.ring().lastRotation().toString());
        if (outcome.rotated()) {
            details.put("admitted_sha256", outcome.admitted().fingerprint());
            details.put("evicted_sha256", outcome.evicted().fingerprint());
        } else {
            details.put("retry_after_ms", outcome.retryAfter().toMillis());
        }
        return details;
    }

    /** Audit rows are best effort: a failed append is logged and never undoes or hides the rotation. */
    private void audit(String region, String keyId, String actor, String result, Map<String, Object> details) {
        try {
            AuditLogger logger = auditLoggers.computeIfAbsent(config.forRegion(region).region(),
                    r -> new AuditLogger(config.forRegion(r).auditFile(), r, clock));
            logger.log(AuditLogger.AuditEvent.of(AUDIT_ACTION, actor, keyId, result, details));
        } catch (RuntimeException e) {
            LOGGER.error("Failed to write {} audit row for {} in region {}", result, keyId, region, e);
        }
    }
}
