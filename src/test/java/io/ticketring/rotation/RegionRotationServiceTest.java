package io.ticketring.rotation;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketring.KeyFixtures;
import io.ticketring.config.TicketRingConfig;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyRing;
import io.ticketring.model.Slot;
import io.ticketring.observability.AuditLogger;
import io.ticketring.storage.KeyCacheStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.ticketring.KeyFixtures.key;

final class RegionRotationServiceTest {
    private static final Instant T0 = Instant.parse("2026-01-10T00:00:00Z");
    private static final String KEY_ID = "/etc/lb/tls-ticket-keys";

    private static RegionRotationService service(TicketRingConfig config, Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        return new RegionRotationService(config, new KeyCacheStore(config),
                new RotationEngine(new KeyMaterialCodec(), clock), clock);
    }

    @Test
    void rotationIsPersistedAndAudited() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            KeyCacheStore store = new KeyCacheStore(config);
            store.bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);

            Instant now = T0.plus(Duration.ofHours(13));
            RotationOutcome outcome = service(config, now).rotate("default", KEY_ID, key(0xD), "ops");

            Assertions.assertTrue(outcome.rotated());
            KeyRing persisted = store.getRing(store.load("default"), KEY_ID);
            Assertions.assertEquals(List.of(key(0xB), key(0xC), key(0xD)), persisted.slots());
            Assertions.assertEquals(now, persisted.lastRotation());

            AuditLogger audit = new AuditLogger(config.auditFile(), "default", Clock.systemUTC());
            List<JsonNode> rows = audit.tail(10);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals("ticket_key.rotate", rows.get(0).path("action").asText());
            Assertions.assertEquals("rotated", rows.get(0).path("result").asText());
            Assertions.assertEquals("ops", rows.get(0).path("actor").asText());
            Assertions.assertEquals(key(0xA).fingerprint(), rows.get(0).path("details").path("evicted_sha256").asText());
            Assertions.assertFalse(rows.get(0).toString().contains(key(0xD).value()));
            Assertions.assertEquals(0, audit.verify());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void tooSoonLeavesDocumentUntouched() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            new KeyCacheStore(config).bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            byte[] before = Files.readAllBytes(config.cacheFile());

            RotationOutcome outcome = service(config, T0.plus(Duration.ofHours(1))).rotate("default", KEY_ID, key(0xD));

            Assertions.assertEquals(RotationOutcome.Status.TOO_SOON, outcome.status());
            Assertions.assertEquals(Duration.ofHours(11), outcome.retryAfter());
            Assertions.assertArrayEquals(before, Files.readAllBytes(config.cacheFile()));
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void corruptPersistedSlotFailsWithoutRewritingDocument() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            new KeyCacheStore(config).bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            String document = Files.readString(config.cacheFile(), StandardCharsets.UTF_8);
            Files.writeString(config.cacheFile(),
                    document.replace(key(0xB).value(), KeyFixtures.ofLength(17).value()), StandardCharsets.UTF_8);
            byte[] before = Files.readAllBytes(config.cacheFile());

            TicketRingException failure = Assertions.assertThrows(TicketRingException.class,
                    () -> service(config, T0.plus(Duration.ofDays(1))).rotate("default", KEY_ID, key(0xD)));

            Assertions.assertEquals(ErrorCode.CORRUPT_RING_STATE, failure.code());
            Assertions.assertEquals(Slot.CURRENT, failure.slot());
            Assertions.assertTrue(failure.getMessage().contains("second"));
            Assertions.assertArrayEquals(before, Files.readAllBytes(config.cacheFile()));

            JsonNode row = new AuditLogger(config.auditFile(), "default", Clock.systemUTC()).tail(1).get(0);
            Assertions.assertEquals("failed", row.path("result").asText());
            Assertions.assertEquals("second", row.path("details").path("slot").asText());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void auditWriteFailureDoesNotHideRotation() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            KeyCacheStore store = new KeyCacheStore(config);
            store.bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            Files.createDirectories(config.auditFile());

            RotationOutcome outcome = service(config, T0.plus(Duration.ofHours(13))).rotate("default", KEY_ID, key(0xD));

            Assertions.assertTrue(outcome.rotated());
            Assertions.assertEquals(key(0xD), store.getRing(store.load("default"), KEY_ID).newest());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void auditRowsFromSeparateServicesShareOneChain() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            new KeyCacheStore(config).bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            RegionRotationService first = service(config, T0.plus(Duration.ofHours(13)));
            RegionRotationService second = service(config, T0.plus(Duration.ofHours(14)));

            first.rotate("default", KEY_ID, key(0xD));
            second.rotate("default", KEY_ID, key(0xE));
            first.rotate("default", KEY_ID, key(0xF));

            AuditLogger audit = new AuditLogger(config.auditFile(), "default", Clock.systemUTC());
            Assertions.assertEquals(3, audit.tail(10).size());
            Assertions.assertEquals(0, audit.verify());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void unknownKeyIdAndMissingRegionAreReported() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            RegionRotationService service = service(config, T0);
            Assertions.assertEquals(ErrorCode.CACHE_UNAVAILABLE, Assertions.assertThrows(TicketRingException.class,
                    () -> service.rotate("default", KEY_ID, null)).code());

            new KeyCacheStore(config).bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            Assertions.assertEquals(ErrorCode.KEY_ID_NOT_FOUND, Assertions.assertThrows(TicketRingException.class,
                    () -> service.rotate("default", "other", null)).code());
            Assertions.assertEquals(ErrorCode.INVALID_ARGUMENT, Assertions.assertThrows(TicketRingException.class,
                    () -> service.rotate("default", " ", null)).code());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void concurrentRotationsRotateOnce() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-rotate");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            KeyCacheStore store = new KeyCacheStore(config);
            store.bootstrapRing("default", KEY_ID, List.of(key(0xA), key(0xB), key(0xC)), T0);
            RegionRotationService service = service(config, T0.plus(Duration.ofHours(13)));

            CountDownLatch start = new CountDownLatch(1);
            List<Future<RotationOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                int candidate = 0x20 + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return service.rotate("default", KEY_ID, key(candidate));
                }));
            }
            start.countDown();

            int rotated = 0;
            RotationOutcome winner = null;
            for (Future<RotationOutcome> future : futures) {
                RotationOutcome outcome = future.get(30, TimeUnit.SECONDS);
                if (outcome.rotated()) {
                    rotated++;
                    winner = outcome;
                } else {
                    Assertions.assertEquals(RotationOutcome.Status.TOO_SOON, outcome.status());
                }
            }
            Assertions.assertEquals(1, rotated);
            KeyRing persisted = store.getRing(store.load("default"), KEY_ID);
            Assertions.assertEquals(List.of(key(0xB), key(0xC), winner.admitted()), persisted.slots());
        } finally {
            pool.shutdownNow();
            KeyFixtures.deleteRecursively(dir);
        }
    }
}
