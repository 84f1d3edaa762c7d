package io.ticketring.storage;

import io.ticketring.model.KeyRing;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One region's key rings as read from (or about to be written to) its cache document.
 *
 * <p>{@code sourceDigest} is the SHA-256 of the document bytes this cache was loaded from, or
 * {@code null} when no document existed. {@link KeyCacheStore#save} compares it against the
 * document on disk before replacing it.
 */
public final class KeyCache {
    private final String region;
    private final TreeMap<String, KeyRing> rings;
    private final String sourceDigest;

    KeyCache(String region, TreeMap<String, KeyRing> rings, String sourceDigest) {
        this.region = region;
        this.rings = rings;
        this.sourceDigest = sourceDigest;
    }

    public static KeyCache empty(String region) {
        return new KeyCache(region, new TreeMap<>(), null);
    }

    public String region() {
        return region;
    }

    public Optional<KeyRing> ring(String keyId) {
        return Optional.ofNullable(rings.get(keyId));
    }

    public boolean contains(String keyId) {
        return rings.containsKey(keyId);
    }

    public Set<String> keyIds() {
        return Collections.unmodifiableSet(rings.keySet());
    }

    public Collection<KeyRing> rings() {
        return Collections.unmodifiableCollection(rings.values());
    }

    public int size() {
        return rings.size();
    }

    public String sourceDigest() {
        return sourceDigest;
    }

    /** Copy of this cache with {@code ring} added or replacing the ring with the same key id. */
    public KeyCache withRing(KeyRing ring) {
        TreeMap<String, KeyRing> next = new TreeMap<>(rings);
        next.put(ring.keyId(), ring);
        return new KeyCache(region, next, sourceDigest);
    }

    KeyCache withSourceDigest(String digest) {
        return new KeyCache(region, new TreeMap<>(rings), digest);
    }
}
