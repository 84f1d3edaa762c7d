package io.ticketring.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketring.util.Hashing;
import io.ticketring.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained JSON-lines record of rotations and fleet pushes for one region.
 * Rows carry key fingerprints only.
 */
public final class AuditLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuditLogger.class);
    // FileChannel locks are per process; threads of one JVM serialise here first.
    private static final ConcurrentMap<Path, ReentrantLock> FILE_LOCKS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String region;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String region, Clock clock) {
        this.auditFile = auditFile;
        this.region = region == null || region.isBlank() ? "default" : region.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    /**
     * Appends one row. The chain tip is re-read from the file under an exclusive lock, so several
     * loggers or processes appending to the same file keep a single chain.
     */
    public synchronized void log(AuditEvent event) {
        ReentrantLock local = FILE_LOCKS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), ignored -> new ReentrantLock());
        local.lock();
        try (FileChannel channel = FileChannel.open(auditFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {
            String prevHash = readLastHash();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", clock.instant().toString());
            row.put("region", region);
            row.put("action", event.action());
            row.put("actor", event.actor());
            row.put("key_id", event.keyId());
            row.put("result", event.result());
            row.put("details", event.details());
            row.put("prev_hash", prevHash);
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            ByteBuffer line = ByteBuffer.wrap((Jsons.toCompactJson(row) + System.lineSeparator())
                    .getBytes(StandardCharsets.UTF_8));
            while (line.hasRemaining()) {
                channel.write(line);
            }
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log: " + auditFile, e);
        } finally {
            local.unlock();
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int limit) {
        List<JsonNode> rows = new ArrayList<>();
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            for (String line : lines.subList(from, lines.size())) {
                if (!line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        return rows;
    }

    /**
     * Recomputes the hash chain. Returns the 1-based line number of the first broken row, or 0 when intact.
     */
    public int verify() {
        try {
            String expectedPrev = "";
            int lineNo = 0;
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))
                        || !Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                    return lineNo;
                }
                expectedPrev = String.valueOf(hash);
            }
            return 0;
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            return readLastHash();
        } catch (IOException e) {
            LOGGER.warn("Audit log {} has an unreadable last row; starting a new hash chain", auditFile, e);
            return "";
        }
    }

    private String readLastHash() throws IOException {
        String last = "";
        for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        return Jsons.mapper().readTree(last).path("hash").asText("");
    }

    public record AuditEvent(
            String action,
            String actor,
            String keyId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String keyId, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    actor == null || actor.isBlank() ? "ticketring" : actor.trim(),
                    keyId,
                    result,
                    details == null ? Map.of() : details
            );
        }
    }
}
