package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import io.ticketring.key.KeyMaterialCodec;
import io.ticketring.model.KeyMaterial;
import io.ticketring.model.RuntimeKeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and updates the in-memory ticket key window of a running instance through its runtime API.
 *
 * <p>Commands:
 * <ul>
 *   <li>{@code show tls-keys} lists the key ids the instance tracks</li>
 *   <li>{@code show tls-keys <key_id>} prints the three keys of one id, former first</li>
 *   <li>{@code set ssl tls-key <key_id> <key>} admits a key as {@code next}; the instance ages
 *       {@code next -> current -> former} and forgets its former key</li>
 * </ul>
 *
 * <p>{@link #insert} is not idempotent: every accepted call ages the window once more. Fleet-wide
 * delivery with retries goes through {@link FleetPushCoordinator}.
 */
public final class RuntimeSyncClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeSyncClient.class);

    static final String LIST_ALL = "show tls-keys";
    static final String LIST_ONE = "show tls-keys ";
    static final String SET = "set ssl tls-key ";
    static final String SET_ACCEPTED = "tls ticket key updated";
    static final String NOT_LOCATED = "unable to locate";

    private static final Pattern ENTRY_LINE = Pattern.compile("^(\\S+)\\s+\\((.*)\\)\\s*$");
    private static final Pattern KEY_LINE = Pattern.compile("^(\\S+)\\.(\\d+)\\s+(\\S+)\\s*$");

    private final CommandChannel channel;
    private final KeyMaterialCodec codec;

    public RuntimeSyncClient(CommandChannel channel, KeyMaterialCodec codec) {
        this.channel = channel;
        this.codec = codec;
    }

    public List<RuntimeKeyEntry> listAll(InstanceEndpoint instance) {
        String response = channel.execute(instance, LIST_ALL);
        List<RuntimeKeyEntry> entries = new ArrayList<>();
        for (String line : meaningfulLines(response)) {
            Matcher matcher = ENTRY_LINE.matcher(line);
            if (matcher.matches() && !matcher.group(2).isBlank()) {
                entries.add(new RuntimeKeyEntry(matcher.group(2).trim(), "ref #" + matcher.group(1)));
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            entries.add(new RuntimeKeyEntry(parts[0], parts.length > 1 ? parts[1] : ""));
        }
        return entries;
    }

    public RuntimeKeySet listOne(InstanceEndpoint instance, String keyId) {
        requireKeyId(keyId);
        String response = channel.execute(instance, LIST_ONE + keyId);
        if (isNotLocated(response)) {
            throw notTracked(instance, keyId);
        }
        List<KeyMaterial> keys = new ArrayList<>();
        for (String line : meaningfulLines(response)) {
            Matcher matcher = KEY_LINE.matcher(line);
            if (!matcher.matches()) {
                throw new TicketRingException(ErrorCode.CHANNEL_ERROR,
                        "Unexpected line in key listing from " + instance.name() + ": " + abbreviate(line));
            }
            keys.add(new KeyMaterial(matcher.group(3)));
        }
        if (keys.isEmpty()) {
            throw notTracked(instance, keyId);
        }
        if (keys.size() != 3) {
            throw new TicketRingException(ErrorCode.CHANNEL_ERROR,
                    "Instance " + instance.name() + " reported " + keys.size() + " keys for " + keyId + ", expected 3");
        }
        return new RuntimeKeySet(keyId, keys.get(0), keys.get(1), keys.get(2));
    }

    public InsertAck insert(InstanceEndpoint instance, String keyId, KeyMaterial key) {
        requireKeyId(keyId);
        codec.validate(key);
        String response = channel.execute(instance, SET + keyId + " " + key.value());
        String text = response == null ? "" : response.strip();
        if (text.toLowerCase(Locale.ROOT).contains(SET_ACCEPTED)) {
            LOGGER.debug("Instance {} admitted key {} for {}", instance.name(), key.fingerprint(), keyId);
            return new InsertAck(instance.name(), keyId, key.fingerprint(), text);
        }
        if (isNotLocated(text)) {
            throw notTracked(instance, keyId);
        }
        throw new TicketRingException(ErrorCode.REJECTED_BY_INSTANCE,
                "Instance " + instance.name() + " rejected key " + key.fingerprint() + " for " + keyId
                        + ": " + (text.isEmpty() ? "<empty response>" : abbreviate(text)));
    }

    private static void requireKeyId(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw TicketRingException.invalidArgument("key id is required");
        }
        for (int i = 0; i < keyId.length(); i++) {
            if (Character.isWhitespace(keyId.charAt(i)) || Character.isISOControl(keyId.charAt(i))) {
                throw TicketRingException.invalidArgument("key id must not contain whitespace: " + keyId);
            }
        }
    }

    private static List<String> meaningfulLines(String response) {
        if (response == null) {
            return List.of();
        }
        return response.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
    }

    private static boolean isNotLocated(String response) {
        return response != null && response.toLowerCase(Locale.ROOT).contains(NOT_LOCATED);
    }

    private static TicketRingException notTracked(InstanceEndpoint instance, String keyId) {
        return new TicketRingException(ErrorCode.NOT_TRACKED,
                "Instance " + instance.name() + " does not track key id " + keyId);
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\r', ' ').replace('\n', ' ');
        return oneLine.length() <= 200 ? oneLine : oneLine.substring(0, 200) + "...";
    }
}
