package com.celia.orchestrator.llm;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded response cache keyed by a SHA-256 hash of (message, system instruction, JSON mode).
 *
 * Entries expire after {@code ttl}; beyond {@code capacity} the least recently
 * used entry is evicted. All access is serialized on this instance's monitor.
 * Two threads missing on the same key at once will both call through.
 */
public class ResponseCache {

    private record Entry(String value, Instant expiresAt) {}

    private final int      capacity;
    private final Duration ttl;
    private final Clock    clock;
    private final LinkedHashMap<String, Entry> entries;

    public ResponseCache(int capacity, Duration ttl, Clock clock) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");
        this.capacity = capacity;
        this.ttl      = ttl;
        this.clock    = clock;
        this.entries  = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > ResponseCache.this.capacity;
            }
        };
    }

    public static String keyFor(GenerationRequest request) {
        String material = nullToEmpty(request.message())
                + '\u0000' + nullToEmpty(request.systemInstruction())
                + '\u0000' + request.jsonMode();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public synchronized Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public synchronized void put(String key, String value) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
