package io.ticketring.model;

import java.util.List;

/**
 * Key window a running instance holds in memory for one key id. Lost when the instance restarts.
 */
public record RuntimeKeySet(
        String keyId,
        KeyMaterial former,
        KeyMaterial current,
        KeyMaterial next
) {
    public List<KeyMaterial> keys() {
        return List.of(former, current, next);
    }

    public boolean holds(KeyMaterial key) {
        return former.equals(key) || current.equals(key) || next.equals(key);
    }
}
