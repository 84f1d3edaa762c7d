package io.ticketring.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketring.KeyFixtures;
import io.ticketring.config.TicketRingConfig;
import io.ticketring.storage.KeyCacheStore;
import io.ticketring.util.Jsons;
import picocli.CommandLine;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static io.ticketring.KeyFixtures.key;

final class TicketRingCommandTest {
    private static final Instant T0 = Instant.parse("2026-01-10T00:00:00Z");

    private record Run(int exit, String out, String err) {
        JsonNode json() throws Exception {
            return Jsons.mapper().readTree(out);
        }
    }

    private static Run run(Instant now, String... args) {
        TicketRingCommand root = new TicketRingCommand();
        root.clock = Clock.fixed(now, ZoneOffset.UTC);
        CommandLine commandLine = TicketRingCommand.commandLine(root);
        StringWriter err = new StringWriter();
        commandLine.setErr(new PrintWriter(err, true));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream previous = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            int exit = commandLine.execute(args);
            return new Run(exit, out.toString(StandardCharsets.UTF_8), err.toString());
        } finally {
            System.setOut(previous);
        }
    }

    private static Path seedFile(Path dir) throws Exception {
        Path seed = dir.resolve("seed.keys");
        Files.writeString(seed, key(1).value() + "\n" + key(2).value() + "\n" + key(3).value() + "\n", StandardCharsets.UTF_8);
        return seed;
    }

    @Test
    void bootstrapThenRotateRespectsCooldown() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-cli");
        try {
            String cacheDir = dir.resolve("cache").toString();
            Run bootstrap = run(T0, "--cache-dir", cacheDir, "--region", "eu-west",
                    "bootstrap", "--key-id", "lb", "--seed-file", seedFile(dir).toString());
            Assertions.assertEquals(0, bootstrap.exit(), bootstrap.err());
            Assertions.assertEquals(key(3).fingerprint(), bootstrap.json().path("newest_sha256").asText());

            Run early = run(T0.plus(Duration.ofHours(1)), "--cache-dir", cacheDir, "--region", "eu-west",
                    "rotate", "--key-id", "lb", "--key", key(4).value());
            Assertions.assertEquals(0, early.exit(), early.err());
            Assertions.assertEquals("TOO_SOON", early.json().path("status").asText());

            Run rotate = run(T0.plus(Duration.ofHours(12)), "--cache-dir", cacheDir, "--region", "eu-west",
                    "rotate", "--key-id", "lb", "--key", key(4).value(), "--actor", "ops");
            Assertions.assertEquals(0, rotate.exit(), rotate.err());
            Assertions.assertEquals("ROTATED", rotate.json().path("status").asText());
            Assertions.assertEquals(key(1).fingerprint(), rotate.json().path("evicted_sha256").asText());
            Assertions.assertFalse(rotate.out().contains(key(4).value()));

            KeyCacheStore store = new KeyCacheStore(TicketRingConfig.fromCacheDir(cacheDir));
            Assertions.assertEquals(key(4), store.getRing(store.load("eu-west"), "lb").newest());

            Run verify = run(T0, "--cache-dir", cacheDir, "--region", "eu-west", "audit-verify");
            Assertions.assertEquals(0, verify.exit(), verify.out());
            Assertions.assertTrue(verify.json().path("intact").asBoolean());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void domainFailuresExitWithJsonError() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-cli");
        try {
            String cacheDir = dir.resolve("cache").toString();
            run(T0, "--cache-dir", cacheDir, "bootstrap", "--key-id", "lb", "--seed-file", seedFile(dir).toString());

            Run unknown = run(T0.plus(Duration.ofDays(1)), "--cache-dir", cacheDir, "rotate", "--key-id", "missing");
            Assertions.assertEquals(1, unknown.exit());
            Assertions.assertEquals("KEY_ID_NOT_FOUND", Jsons.mapper().readTree(unknown.err()).path("error_code").asText());

            Run badKey = run(T0.plus(Duration.ofDays(1)), "--cache-dir", cacheDir, "rotate", "--key-id", "lb", "--key", "c2hvcnQ=");
            Assertions.assertEquals(1, badKey.exit());
            Assertions.assertEquals("INVALID_KEY_FORMAT", Jsons.mapper().readTree(badKey.err()).path("error_code").asText());

            Run duplicate = run(T0, "--cache-dir", cacheDir, "bootstrap", "--key-id", "lb", "--seed-file", seedFile(dir).toString());
            Assertions.assertEquals(1, duplicate.exit());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void rotateWithUnknownPushTargetFailsBeforeRotating() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-cli");
        try {
            String cacheDir = dir.resolve("cache").toString();
            run(T0, "--cache-dir", cacheDir, "bootstrap", "--key-id", "lb", "--seed-file", seedFile(dir).toString());
            Path document = TicketRingConfig.fromCacheDir(cacheDir).cacheFile();
            byte[] before = Files.readAllBytes(document);

            Run rotate = run(T0.plus(Duration.ofHours(13)), "--cache-dir", cacheDir,
                    "rotate", "--key-id", "lb", "--key", key(4).value(), "--push", "--instance", "nosuch");

            Assertions.assertEquals(1, rotate.exit());
            Assertions.assertEquals("INVALID_ARGUMENT", Jsons.mapper().readTree(rotate.err()).path("error_code").asText());
            Assertions.assertArrayEquals(before, Files.readAllBytes(document));

            Run noInstances = run(T0.plus(Duration.ofHours(13)), "--cache-dir", cacheDir,
                    "rotate", "--key-id", "lb", "--key", key(4).value(), "--push");
            Assertions.assertEquals(1, noInstances.exit());
            Assertions.assertArrayEquals(before, Files.readAllBytes(document));

            Run plain = run(T0.plus(Duration.ofHours(13)), "--cache-dir", cacheDir,
                    "rotate", "--key-id", "lb", "--key", key(4).value());
            Assertions.assertEquals("ROTATED", plain.json().path("status").asText());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void validateKeyReportsFingerprintOnly() {
        Run valid = run(T0, "validate-key", "--key", key(5).value());
        Assertions.assertEquals(0, valid.exit());
        Assertions.assertTrue(valid.out().contains(key(5).fingerprint()));
        Assertions.assertFalse(valid.out().contains(key(5).value()));

        Run invalid = run(T0, "validate-key", "--key", "c2hvcnQ=");
        Assertions.assertEquals(1, invalid.exit());
    }
}
