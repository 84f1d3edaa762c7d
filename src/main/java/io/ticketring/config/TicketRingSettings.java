package io.ticketring.config;

import io.ticketring.error.TicketRingException;
import io.ticketring.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective settings, read from {@code ticketring-settings.json} next to the region documents.
 * Missing or out-of-range values fall back to {@link #defaults()}.
 */
public record TicketRingSettings(
        long minRotationIntervalMs,
        long channelTimeoutMs,
        int pushParallelism,
        int pushMaxAttempts,
        List<InstanceEndpoint> instances
) {
    public static final long DEFAULT_MIN_ROTATION_INTERVAL_MS = Duration.ofHours(12).toMillis();
    public static final long DEFAULT_CHANNEL_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_PUSH_PARALLELISM = 8;
    public static final int DEFAULT_PUSH_MAX_ATTEMPTS = 3;

    public TicketRingSettings {
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    public static TicketRingSettings defaults() {
        return new TicketRingSettings(
                DEFAULT_MIN_ROTATION_INTERVAL_MS,
                DEFAULT_CHANNEL_TIMEOUT_MS,
                DEFAULT_PUSH_PARALLELISM,
                DEFAULT_PUSH_MAX_ATTEMPTS,
                List.of()
        );
    }

    public static TicketRingSettings load(TicketRingConfig config) {
        return load(config.settingsFile());
    }

    public static TicketRingSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        SettingsFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (Exception e) {
            throw TicketRingException.invalidArgument("Failed to read settings file " + file + ": " + e.getMessage());
        }
        return fromFile(parsed, defaults());
    }

    static TicketRingSettings fromFile(SettingsFile file, TicketRingSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long minInterval = sanitizeLong(file.minRotationIntervalMs(), defaults.minRotationIntervalMs(), 0L);
        long channelTimeout = sanitizeLong(file.channelTimeoutMs(), defaults.channelTimeoutMs(), 100L);
        int parallelism = sanitizeInt(file.pushParallelism(), defaults.pushParallelism(), 1);
        int maxAttempts = sanitizeInt(file.pushMaxAttempts(), defaults.pushMaxAttempts(), 1);
        List<InstanceEndpoint> instances = new ArrayList<>();
        if (file.instances() != null) {
            for (InstanceFile row : file.instances()) {
                if (row == null || row.address() == null || row.address().isBlank()) {
                    continue;
                }
                instances.add(new InstanceEndpoint(row.name(), row.address(), row.region()));
            }
        }
        return new TicketRingSettings(minInterval, channelTimeout, parallelism, maxAttempts, instances);
    }

    public Duration minRotationInterval() {
        return Duration.ofMillis(minRotationIntervalMs);
    }

    public Duration channelTimeout() {
        return Duration.ofMillis(channelTimeoutMs);
    }

    public List<InstanceEndpoint> instancesFor(String region) {
        return instances.stream().filter(instance -> instance.servesRegion(region)).toList();
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    record SettingsFile(
            Long minRotationIntervalMs,
            Long channelTimeoutMs,
            Integer pushParallelism,
            Integer pushMaxAttempts,
            List<InstanceFile> instances
    ) {
    }

    record InstanceFile(String name, String address, String region) {
    }
}
