package io.ticketring.cli;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.config.TicketRingConfig;
import io.ticketring.config.TicketRingSettings;
import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.KeyRing;
import io.ticketring.model.RuntimeKeySet;
import io.ticketring.observability.AuditLogger;
import io.ticketring.rotation.RegionRotationService;
import io.ticketring.rotation.RotationEngine;
import io.ticketring.rotation.RotationOutcome;
import io.ticketring.seed.FileBackedKeySource;
import io.ticketring.storage.KeyCache;
import io.ticketring.storage.KeyCacheStore;
import io.ticketring.sync.CommandChannel;
import io.ticketring.sync.DriftEntry;
import io.ticketring.sync.FleetPushCoordinator;
import io.ticketring.sync.FleetPushReport;
import io.ticketring.sync.FleetReconciler;
import io.ticketring.sync.ReconcileReport;
import io.ticketring.sync.RuntimeSyncClient;
import io.ticketring.sync.SocketCommandChannel;
import io.ticketring.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "ticketring",
        mixinStandardHelpOptions = true,
        description = "TLS session ticket key rotation and fleet synchronisation",
        subcommands = {
                TicketRingCommand.GenerateKeyCommand.class,
                TicketRingCommand.ValidateKeyCommand.class,
                TicketRingCommand.SeedCheckCommand.class,
                TicketRingCommand.BootstrapCommand.class,
                TicketRingCommand.ShowCommand.class,
                TicketRingCommand.RotateCommand.class,
                TicketRingCommand.RuntimeListCommand.class,
                TicketRingCommand.RuntimeShowCommand.class,
                TicketRingCommand.PushCommand.class,
                TicketRingCommand.DriftCommand.class,
                TicketRingCommand.ReconcileCommand.class,
                TicketRingCommand.AuditTailCommand.class,
                TicketRingCommand.AuditVerifyCommand.class
        }
)
public final class TicketRingCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL = 2;

    @Option(names = {"--cache-dir"}, description = "Directory holding region key cache documents", defaultValue = "ticket-key-cache")
    String cacheDir;

    @Option(names = {"--region"}, description = "Region whose key cache is used", defaultValue = "default")
    String region;

    Clock clock = Clock.systemUTC();
    CommandChannel channel;

    public static CommandLine commandLine() {
        return commandLine(new TicketRingCommand());
    }

    static CommandLine commandLine(TicketRingCommand root) {
        return new CommandLine(root).setExecutionExceptionHandler(new CliErrorHandler());
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: generate-key | validate-key | seed-check | bootstrap | show | rotate | runtime-list | runtime-show | push | drift | reconcile | audit-tail | audit-verify");
    }

    TicketRingConfig config() {
        return TicketRingConfig.fromCacheDir(cacheDir, region);
    }

    TicketRingSettings settings() {
        return TicketRingSettings.load(config());
    }

    KeyCacheStore store() {
        return new KeyCacheStore(config());
    }

    RegionRotationService rotationService(TicketRingSettings settings) {
        RotationEngine engine = new RotationEngine(new KeyMaterialCodec(), clock, settings.minRotationInterval());
        return new RegionRotationService(config(), store(), engine, clock);
    }

    FleetPushCoordinator coordinator(TicketRingSettings settings) {
        CommandChannel transport = channel == null ? new SocketCommandChannel(settings.channelTimeout()) : channel;
        RuntimeSyncClient client = new RuntimeSyncClient(transport, new KeyMaterialCodec());
        return new FleetPushCoordinator(client, settings.pushParallelism(), settings.pushMaxAttempts());
    }

    List<InstanceEndpoint> instances(TicketRingSettings settings, List<String> selectors) {
        List<InstanceEndpoint> known = settings.instancesFor(config().region());
        if (selectors == null || selectors.isEmpty()) {
            if (known.isEmpty()) {
                throw TicketRingException.invalidArgument("No instances configured for region " + config().region()
                        + "; pass --instance or list them in " + config().settingsFile());
            }
            return known;
        }
        List<InstanceEndpoint> out = new ArrayList<>();
        for (String selector : selectors) {
            InstanceEndpoint match = known.stream()
                    .filter(instance -> instance.name().equals(selector))
                    .findFirst()
                    .orElse(null);
            if (match == null && selector.contains(":")) {
                match = InstanceEndpoint.of(selector, selector);
            }
            if (match == null) {
                throw TicketRingException.invalidArgument("Unknown instance: " + selector);
            }
            out.add(match);
        }
        return out;
    }

    KeyRing ring(String keyId) {
        KeyCacheStore store = store();
        return store.getRing(store.load(config().region()), keyId);
    }

    static Map<String, Object> ringView(KeyRing ring, Duration minInterval) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key_id", ring.keyId());
        view.put("last_rotation", ring.lastRotation().toString());
        view.put("next_rotation_after", ring.lastRotation().plus(minInterval).toString());
        view.put("oldest_sha256", ring.oldest().fingerprint());
        view.put("current_sha256", ring.current().fingerprint());
        view.put("newest_sha256", ring.newest().fingerprint());
        return view;
    }

    static Map<String, Object> windowView(String instance, RuntimeKeySet window) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("instance", instance);
        view.put("key_id", window.keyId());
        view.put("former_sha256", window.former().fingerprint());
        view.put("current_sha256", window.current().fingerprint());
        view.put("next_sha256", window.next().fingerprint());
        return view;
    }

    static Map<String, Object> pushView(FleetPushReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key_id", report.keyId());
        view.put("key_sha256", report.keyFingerprint());
        view.put("delivered", report.delivered());
        view.put("failed", report.failed());
        view.put("instances", report.results());
        return view;
    }

    static KeyMaterial optionalKey(String raw) {
        return raw == null || raw.isBlank() ? null : new KeyMaterial(raw);
    }

    @Command(name = "generate-key", description = "Print a fresh random 48-byte ticket key (base64)")
    static final class GenerateKeyCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            KeyMaterial key = new KeyMaterialCodec().generate();
            System.out.println(key.value());
            return EXIT_OK;
        }
    }

    @Command(name = "validate-key", description = "Check that a value is base64 of exactly 48 bytes")
    static final class ValidateKeyCommand implements Callable<Integer> {
        @Option(names = {"--key"}, required = true, description = "Base64 ticket key")
        String key;

        @Override
        public Integer call() {
            KeyMaterial material = new KeyMaterialCodec().validate(key);
            System.out.println(Jsons.toJson(Map.of("valid", true, "sha256", material.fingerprint())));
            return EXIT_OK;
        }
    }

    @Command(name = "seed-check", description = "Validate a 3-line seed file")
    static final class SeedCheckCommand implements Callable<Integer> {
        @Option(names = {"--file"}, required = true, description = "Seed file path")
        Path file;

        @Override
        public Integer call() {
            List<KeyMaterial> keys = new FileBackedKeySource(new KeyMaterialCodec()).read(file);
            List<String> fingerprints = keys.stream().map(KeyMaterial::fingerprint).toList();
            System.out.println(Jsons.toJson(Map.of("file", file.toString(), "keys_sha256", fingerprints)));
            return EXIT_OK;
        }
    }

    @Command(name = "bootstrap", description = "Create a key ring from a seed file (never overwrites an existing ring)")
    static final class BootstrapCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--seed-file"}, required = true, description = "3-line seed file, oldest first")
        Path seedFile;

        @Option(names = {"--last-rotation"}, description = "Initial last rotation, ISO-8601 instant (default: now)")
        Instant lastRotation;

        @Override
        public Integer call() {
            List<KeyMaterial> seed = new FileBackedKeySource(new KeyMaterialCodec()).read(seedFile);
            Instant rotatedAt = lastRotation == null ? parent.clock.instant() : lastRotation;
            KeyRing ring = parent.store().bootstrapRing(parent.config().region(), keyId, seed, rotatedAt);
            System.out.println(Jsons.toJson(ringView(ring, parent.settings().minRotationInterval())));
            return EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show persisted key rings (fingerprints only)")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, description = "Only this key identifier")
        String keyId;

        @Override
        public Integer call() {
            Duration minInterval = parent.settings().minRotationInterval();
            KeyCacheStore store = parent.store();
            KeyCache cache = store.load(parent.config().region());
            List<Map<String, Object>> rings = new ArrayList<>();
            if (keyId != null) {
                rings.add(ringView(store.getRing(cache, keyId), minInterval));
            } else {
                cache.rings().forEach(ring -> rings.add(ringView(ring, minInterval)));
            }
            System.out.println(Jsons.toJson(Map.of("region", cache.region(), "rings", rings)));
            return EXIT_OK;
        }
    }

    @Command(name = "rotate", description = "Rotate a key ring if its cooldown has elapsed, optionally pushing the new key")
    static final class RotateCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--key"}, description = "Key to admit (base64, 48 bytes); generated when omitted")
        String key;

        @Option(names = {"--actor"}, description = "Who asked for the rotation (audit)")
        String actor;

        @Option(names = {"--push"}, defaultValue = "false", description = "Push the admitted key to the region's instances")
        boolean push;

        @Option(names = {"--instance"}, description = "Instance name or address to push to (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            List<InstanceEndpoint> targets = push ? parent.instances(settings, instances) : List.of();
            RotationOutcome outcome = parent.rotationService(settings)
                    .rotate(parent.config().region(), keyId, optionalKey(key), actor);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("status", outcome.status().name());
            view.put("ring", ringView(outcome.ring(), settings.minRotationInterval()));
            if (outcome.rotated()) {
                view.put("evicted_sha256", outcome.evicted().fingerprint());
            } else {
                view.put("retry_after", outcome.retryAfter().toString());
            }
            int exit = EXIT_OK;
            if (push && outcome.rotated()) {
                try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                    FleetPushReport report = coordinator.push(keyId, outcome.admitted(), targets);
                    view.put("push", pushView(report));
                    exit = report.complete() ? EXIT_OK : EXIT_PARTIAL;
                }
            }
            System.out.println(Jsons.toJson(view));
            return exit;
        }
    }

    @Command(name = "runtime-list", description = "List key ids tracked by running instances")
    static final class RuntimeListCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--instance"}, description = "Instance name or address (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            List<Map<String, Object>> rows = new ArrayList<>();
            int exit = EXIT_OK;
            try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                for (InstanceEndpoint instance : parent.instances(settings, instances)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("instance", instance.name());
                    try {
                        row.put("keys", coordinator.client().listAll(instance));
                    } catch (TicketRingException e) {
                        row.put("error_code", e.code().name());
                        row.put("error", e.getMessage());
                        exit = EXIT_PARTIAL;
                    }
                    rows.add(row);
                }
            }
            System.out.println(Jsons.toJson(rows));
            return exit;
        }
    }

    @Command(name = "runtime-show", description = "Show the key window running instances hold for a key id")
    static final class RuntimeShowCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--instance"}, description = "Instance name or address (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            List<Map<String, Object>> rows = new ArrayList<>();
            int exit = EXIT_OK;
            try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                for (InstanceEndpoint instance : parent.instances(settings, instances)) {
                    try {
                        rows.add(windowView(instance.name(), coordinator.client().listOne(instance, keyId)));
                    } catch (TicketRingException e) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("instance", instance.name());
                        row.put("error_code", e.code().name());
                        row.put("error", e.getMessage());
                        rows.add(row);
                        exit = EXIT_PARTIAL;
                    }
                }
            }
            System.out.println(Jsons.toJson(rows));
            return exit;
        }
    }

    @Command(name = "push", description = "Push a key (default: the ring's newest) to running instances")
    static final class PushCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--key"}, description = "Explicit key to push instead of the ring's newest")
        String key;

        @Option(names = {"--instance"}, description = "Instance name or address (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            KeyMaterial material = optionalKey(key);
            if (material == null) {
                material = parent.ring(keyId).newest();
            }
            try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                FleetPushReport report = coordinator.push(keyId, material, parent.instances(settings, instances));
                System.out.println(Jsons.toJson(pushView(report)));
                return report.complete() ? EXIT_OK : EXIT_PARTIAL;
            }
        }
    }

    @Command(name = "drift", description = "Compare a persisted ring with the windows of running instances")
    static final class DriftCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--instance"}, description = "Instance name or address (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            KeyRing ring = parent.ring(keyId);
            try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                List<DriftEntry> drift = new FleetReconciler(coordinator)
                        .inspect(ring, parent.instances(settings, instances));
                System.out.println(Jsons.toJson(drift));
                boolean inSync = drift.stream().allMatch(entry -> entry.status() == DriftEntry.Status.IN_SYNC);
                return inSync ? EXIT_OK : EXIT_PARTIAL;
            }
        }
    }

    @Command(name = "reconcile", description = "Push a ring's newest key to instances that lack it")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--key-id"}, required = true, description = "Key identifier")
        String keyId;

        @Option(names = {"--instance"}, description = "Instance name or address (repeatable)")
        List<String> instances;

        @Override
        public Integer call() {
            TicketRingSettings settings = parent.settings();
            KeyRing ring = parent.ring(keyId);
            try (FleetPushCoordinator coordinator = parent.coordinator(settings)) {
                ReconcileReport report = new FleetReconciler(coordinator)
                        .reconcile(ring, parent.instances(settings, instances));
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("drift", report.drift());
                if (report.push() != null) {
                    view.put("push", pushView(report.push()));
                }
                System.out.println(Jsons.toJson(view));
                return report.push() == null || report.push().complete() ? EXIT_OK : EXIT_PARTIAL;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit rows for the region")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            TicketRingConfig config = parent.config();
            AuditLogger audit = new AuditLogger(config.auditFile(), config.region(), parent.clock);
            System.out.println(Jsons.toJson(audit.tail(limit)));
            return EXIT_OK;
        }
    }

    @Command(name = "audit-verify", description = "Verify the region audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TicketRingCommand parent;

        @Override
        public Integer call() {
            TicketRingConfig config = parent.config();
            AuditLogger audit = new AuditLogger(config.auditFile(), config.region(), parent.clock);
            int broken = audit.verify();
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("file", config.auditFile().toString());
            view.put("intact", broken == 0);
            if (broken > 0) {
                view.put("first_broken_line", broken);
            }
            System.out.println(Jsons.toJson(view));
            return broken == 0 ? EXIT_OK : 1;
        }
    }
}
