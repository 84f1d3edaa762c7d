package io.ticketring.seed;

import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyMaterial;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the static seed file a load balancer loads its initial ticket keys from: exactly three
 * base64 lines, oldest first. The seed file is never rewritten by rotation.
 */
public final class FileBackedKeySource {
    public static final int SEED_LINES = 3;

    private final KeyMaterialCodec codec;

    public FileBackedKeySource(KeyMaterialCodec codec) {
        this.codec = codec;
    }

    public List<KeyMaterial> read(Path path) {
        if (path == null) {
            throw TicketRingException.invalidArgument("seed file path is required");
        }
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.SEED_FORMAT_ERROR, "Failed to read seed file: " + path, e);
        }
        List<String> lines = raw.lines().toList();
        if (lines.size() != SEED_LINES) {
            throw new TicketRingException(ErrorCode.SEED_FORMAT_ERROR,
                    "Seed file " + path + " must contain exactly " + SEED_LINES + " lines, found " + lines.size());
        }
        List<KeyMaterial> keys = new ArrayList<>(SEED_LINES);
        for (int i = 0; i < lines.size(); i++) {
            KeyMaterial key = new KeyMaterial(lines.get(i).stripTrailing());
            try {
                keys.add(codec.validate(key));
            } catch (TicketRingException e) {
                throw new TicketRingException(ErrorCode.SEED_FORMAT_ERROR,
                        "Seed file " + path + " line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return List.copyOf(keys);
    }
}
