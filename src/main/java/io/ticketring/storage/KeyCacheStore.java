package io.ticketring.storage;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ticketring.config.TicketRingConfig;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.KeyRing;
import io.ticketring.model.Slot;
import io.ticketring.util.Hashing;
import io.ticketring.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Reads and writes the per-region key cache document:
 *
 * <pre>
 * { "&lt;key_id&gt;": { "last_rotation": 1729600000.0,
 *                    "keys": { "first": "..", "second": "..", "third": ".." } } }
 * </pre>
 *
 * Writes go to a temp file in the same directory that is then atomically renamed over the document,
 * so a concurrent {@link #load} sees either the old or the new document. Load-modify-save cycles
 * must run inside {@link #withRegionLock}.
 */
public final class KeyCacheStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyCacheStore.class);

    private static final String FIELD_LAST_ROTATION = "last_rotation";
    private static final String FIELD_KEYS = "keys";
    private static final int EPOCH_SCALE = 6;
    private static final KeyMaterialCodec CODEC = new KeyMaterialCodec();

    private final TicketRingConfig config;

    public KeyCacheStore(TicketRingConfig config) {
        this.config = config;
    }

    public boolean exists(String region) {
        return Files.exists(paths(region).cacheFile());
    }

    public KeyCache load(String region) {
        TicketRingConfig regionPaths = paths(region);
        Path file = regionPaths.cacheFile();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new TicketRingException(ErrorCode.CACHE_UNAVAILABLE,
                    "No key cache document for region " + regionPaths.region() + ": " + file, e);
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.CACHE_UNAVAILABLE,
                    "Failed to read key cache document: " + file, e);
        }
        TreeMap<String, KeyRing> rings = parseDocument(bytes, file);
        return new KeyCache(regionPaths.region(), rings, Hashing.sha256Hex(bytes));
    }

    /**
     * Replaces the region document with {@code cache}. Fails with {@link ErrorCode#PERSISTENCE_ERROR},
     * leaving the prior document in place, if the document changed since {@code cache} was loaded.
     *
     * @return the cache as persisted, carrying the digest of the new document
     */
    public KeyCache save(String region, KeyCache cache) {
        TicketRingConfig regionPaths = paths(region);
        Path file = regionPaths.cacheFile();
        byte[] bytes = renderDocument(cache).getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(regionPaths.cacheDir());
            verifyUnchanged(file, cache.sourceDigest());
            writeAtomically(file, bytes);
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.PERSISTENCE_ERROR,
                    "Failed to persist key cache document: " + file, e);
        }
        LOGGER.debug("Persisted {} key ring(s) for region {}", cache.size(), regionPaths.region());
        return cache.withSourceDigest(Hashing.sha256Hex(bytes));
    }

    public KeyRing getRing(KeyCache cache, String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw TicketRingException.invalidArgument("key id is required");
        }
        return cache.ring(keyId).orElseThrow(() -> new TicketRingException(ErrorCode.KEY_ID_NOT_FOUND,
                "Key id " + keyId + " not found in region " + cache.region()));
    }

    public <T> T withRegionLock(String region, Supplier<T> action) {
        return RegionLock.withLock(paths(region).lockFile(), action);
    }

    /**
     * Adds a new ring built from seed keys, oldest first. Every seed key must be a valid ticket key.
     * Creates the region document when it does not exist yet; never replaces an existing ring.
     */
    public KeyRing bootstrapRing(String region, String keyId, List<KeyMaterial> seedKeys, Instant lastRotation) {
        if (keyId == null || keyId.isBlank()) {
            throw TicketRingException.invalidArgument("key id is required");
        }
        if (seedKeys == null || seedKeys.size() != Slot.values().length) {
            throw TicketRingException.invalidArgument("a key ring is seeded with exactly " + Slot.values().length
                    + " keys, got " + (seedKeys == null ? 0 : seedKeys.size()));
        }
        if (lastRotation == null) {
            throw TicketRingException.invalidArgument("last rotation is required");
        }
        KeyRing ring = KeyRing.of(keyId, lastRotation, seedKeys);
        for (Slot slot : Slot.values()) {
            try {
                CODEC.validate(ring.slot(slot));
            } catch (TicketRingException e) {
                throw new TicketRingException(ErrorCode.INVALID_KEY_FORMAT, "Seed key for slot " + slot.documentName()
                        + " (" + slot.role() + ") of " + keyId + ": " + e.getMessage(), e);
            }
        }
        return withRegionLock(region, () -> {
            KeyCache cache = exists(region) ? load(region) : KeyCache.empty(paths(region).region());
            if (cache.contains(keyId)) {
                throw TicketRingException.invalidArgument(
                        "Key id " + keyId + " already exists in region " + cache.region());
            }
            save(region, cache.withRing(ring));
            LOGGER.info("Bootstrapped key ring {} in region {}", keyId, cache.region());
            return ring;
        });
    }

    private TicketRingConfig paths(String region) {
        if (region == null || region.isBlank()) {
            throw TicketRingException.invalidArgument("region is required");
        }
        return config.forRegion(region);
    }

    private static void verifyUnchanged(Path file, String expectedDigest) throws IOException {
        boolean present = Files.exists(file);
        if (expectedDigest == null) {
            if (present) {
                throw new IOException("key cache document appeared while a new one was being created");
            }
            return;
        }
        if (!present) {
            throw new IOException("key cache document disappeared since it was loaded");
        }
        String actual = Hashing.sha256Hex(Files.readAllBytes(file));
        if (!expectedDigest.equals(actual)) {
            throw new IOException("key cache document changed since it was loaded (expected sha256 "
                    + expectedDigest + ", found " + actual + ")");
        }
    }

    private static void writeAtomically(Path file, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(file.getParent(), "." + file.getFileName() + "-", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static TreeMap<String, KeyRing> parseDocument(byte[] bytes, Path file) {
        JsonNode root;
        try {
            root = Jsons.mapper().reader()
                    .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                    .readTree(bytes);
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.CACHE_CORRUPT,
                    "Key cache document is not valid JSON: " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TicketRingException(ErrorCode.CACHE_CORRUPT,
                    "Key cache document must be a JSON object: " + file);
        }
        TreeMap<String, KeyRing> rings = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            rings.put(entry.getKey(), parseRing(entry.getKey(), entry.getValue(), file));
        }
        return rings;
    }

    private static KeyRing parseRing(String keyId, JsonNode node, Path file) {
        if (keyId.isBlank()) {
            throw corrupt(file, "empty key id");
        }
        if (node == null || !node.isObject()) {
            throw corrupt(file, keyId + " is not an object");
        }
        JsonNode lastRotation = node.get(FIELD_LAST_ROTATION);
        if (lastRotation == null || !lastRotation.isNumber()) {
            throw corrupt(file, keyId + "." + FIELD_LAST_ROTATION + " must be a number");
        }
        JsonNode keys = node.get(FIELD_KEYS);
        if (keys == null || !keys.isObject()) {
            throw corrupt(file, keyId + "." + FIELD_KEYS + " must be an object");
        }
        KeyMaterial[] slots = new KeyMaterial[Slot.values().length];
        for (Slot slot : Slot.values()) {
            JsonNode value = keys.get(slot.documentName());
            if (value == null || !value.isTextual()) {
                throw corrupt(file, keyId + "." + FIELD_KEYS + "." + slot.documentName() + " must be a string");
            }
            slots[slot.ordinal()] = new KeyMaterial(value.asText());
        }
        Instant rotatedAt;
        try {
            rotatedAt = fromEpochSeconds(lastRotation.decimalValue());
        } catch (ArithmeticException | DateTimeException e) {
            throw corrupt(file, keyId + "." + FIELD_LAST_ROTATION + " is out of range");
        }
        return new KeyRing(keyId, rotatedAt, slots[0], slots[1], slots[2]);
    }

    static String renderDocument(KeyCache cache) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        for (KeyRing ring : cache.rings()) {
            ObjectNode entry = root.putObject(ring.keyId());
            entry.put(FIELD_LAST_ROTATION, toEpochSeconds(ring.lastRotation()));
            ObjectNode keys = entry.putObject(FIELD_KEYS);
            for (Slot slot : Slot.values()) {
                keys.put(slot.documentName(), ring.slot(slot).value());
            }
        }
        return Jsons.toJson(root) + System.lineSeparator();
    }

    static BigDecimal toEpochSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.getEpochSecond())
                .add(BigDecimal.valueOf(instant.getNano() / 1_000L, EPOCH_SCALE));
    }

    static Instant fromEpochSeconds(BigDecimal seconds) {
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.HALF_UP).longValueExact();
        return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    }

    private static TicketRingException corrupt(Path file, String detail) {
        return new TicketRingException(ErrorCode.CACHE_CORRUPT, "Key cache document " + file + " is malformed: " + detail);
    }
}
