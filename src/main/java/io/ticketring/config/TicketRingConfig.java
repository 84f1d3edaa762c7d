package io.ticketring.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TicketRingConfig {
    public static final String DEFAULT_REGION = "default";
    public static final String DEFAULT_CACHE_DIR = "ticket-key-cache";
    public static final String SETTINGS_FILE = "ticketring-settings.json";

    private final Path cacheDir;
    private final String region;

    public TicketRingConfig(Path cacheDir, String region) {
        this.cacheDir = cacheDir;
        this.region = region;
    }

    public static TicketRingConfig fromCacheDir(String cacheDir) {
        return fromCacheDir(cacheDir, DEFAULT_REGION);
    }

    public static TicketRingConfig fromCacheDir(String cacheDir, String region) {
        Path resolved = cacheDir == null || cacheDir.isBlank()
                ? Paths.get(DEFAULT_CACHE_DIR)
                : Paths.get(cacheDir);
        return new TicketRingConfig(resolved.toAbsolutePath().normalize(), sanitizeRegion(region));
    }

    public TicketRingConfig forRegion(String otherRegion) {
        return new TicketRingConfig(cacheDir, sanitizeRegion(otherRegion));
    }

    static String sanitizeRegion(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_REGION : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        // Region names become file names; keep them out of hidden/parent-relative territory.
        while (value.startsWith(".")) {
            value = value.substring(1);
        }
        return value.isBlank() ? DEFAULT_REGION : value;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public String region() {
        return region;
    }

    public Path cacheFile() {
        return cacheDir.resolve(region + ".json");
    }

    public Path lockFile() {
        return cacheDir.resolve(region + ".lock");
    }

    public Path settingsFile() {
        return cacheDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return cacheDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve(region + ".audit.jsonl");
    }
}
