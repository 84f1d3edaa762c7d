package io.ticketring.config;

import io.ticketring.KeyFixtures;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class TicketRingSettingsTest {
    @Test
    void missingFileUsesDefaults() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-settings");
        try {
            TicketRingSettings settings = TicketRingSettings.load(TicketRingConfig.fromCacheDir(dir.toString()));
            Assertions.assertEquals(Duration.ofHours(12), settings.minRotationInterval());
            Assertions.assertEquals(Duration.ofSeconds(5), settings.channelTimeout());
            Assertions.assertEquals(8, settings.pushParallelism());
            Assertions.assertEquals(3, settings.pushMaxAttempts());
            Assertions.assertTrue(settings.instances().isEmpty());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void fileValuesOverrideDefaultsAndInvalidOnesFallBack() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-settings");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "minRotationIntervalMs": 3600000,
                      "channelTimeoutMs": 5,
                      "pushParallelism": 0,
                      "pushMaxAttempts": 5,
                      "unknownSetting": true,
                      "instances": [
                        {"name": "lb-1", "address": "tcp://10.0.0.1:9999", "region": "US-East"},
                        {"address": "unix:///run/lb/admin.sock"},
                        {"name": "no-address"}
                      ]
                    }
                    """, StandardCharsets.UTF_8);

            TicketRingSettings settings = TicketRingSettings.load(config);

            Assertions.assertEquals(Duration.ofHours(1), settings.minRotationInterval());
            Assertions.assertEquals(TicketRingSettings.DEFAULT_CHANNEL_TIMEOUT_MS, settings.channelTimeoutMs());
            Assertions.assertEquals(TicketRingSettings.DEFAULT_PUSH_PARALLELISM, settings.pushParallelism());
            Assertions.assertEquals(5, settings.pushMaxAttempts());
            Assertions.assertEquals(2, settings.instances().size());
            Assertions.assertEquals("unix:///run/lb/admin.sock", settings.instances().get(1).name());
            Assertions.assertEquals(List.of("lb-1", "unix:///run/lb/admin.sock"),
                    settings.instancesFor("us-east").stream().map(InstanceEndpoint::name).toList());
            Assertions.assertEquals(List.of("unix:///run/lb/admin.sock"),
                    settings.instancesFor("eu-west").stream().map(InstanceEndpoint::name).toList());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void unreadableFileIsInvalidArgument() throws Exception {
        Path dir = Files.createTempDirectory("ticketring-settings");
        try {
            TicketRingConfig config = TicketRingConfig.fromCacheDir(dir.toString());
            Files.writeString(config.settingsFile(), "{ broken", StandardCharsets.UTF_8);
            TicketRingException failure = Assertions.assertThrows(TicketRingException.class,
                    () -> TicketRingSettings.load(config));
            Assertions.assertEquals(ErrorCode.INVALID_ARGUMENT, failure.code());
        } finally {
            KeyFixtures.deleteRecursively(dir);
        }
    }
}
