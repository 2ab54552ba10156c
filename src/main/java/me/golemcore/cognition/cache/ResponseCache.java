package me.golemcore.cognition.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.cognition.domain.model.CacheEntry;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache of model responses keyed by request fingerprint.
 *
 * <p>
 * Each entry carries its own TTL. When a put pushes the cache over
 * {@code bot.cache.max-entries}, expired entries are dropped first, then the
 * entries with the lowest hit count (oldest first on ties) until the size is
 * back under the cap.
 */
@Component
@Slf4j
public class ResponseCache {

    private final Clock clock;
    private final int maxEntries;
    private final Map<String, CacheEntry> entries = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;

    public ResponseCache(BotProperties properties, Clock clock) {
        this.clock = clock;
        this.maxEntries = properties.getCache().getMaxEntries();
    }

    /**
     * Stable SHA-256 fingerprint of a request payload.
     */
    public static String fingerprint(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                digest.update((part != null ? part : "").getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public synchronized Optional<String> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        entry.setHitCount(entry.getHitCount() + 1);
        hits++;
        return Optional.of(entry.getValue());
    }

    public synchronized void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        entries.put(key, CacheEntry.builder()
                .key(key)
                .value(value)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .hitCount(0)
                .build());
        if (entries.size() > maxEntries) {
            evict(now, key);
        }
    }

    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Drop expired entries.
     *
     * @return number of entries removed
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        return before - entries.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    public synchronized long getEvictions() {
        return evictions;
    }

    private void evict(Instant now, String insertedKey) {
        int expired = 0;
        var iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next(), now)) {
                iterator.remove();
                expired++;
            }
        }

        int leastUsed = 0;
        if (entries.size() > maxEntries) {
            // the entry just stored has no hits yet and must not be its own victim
            List<CacheEntry> candidates = entries.values().stream()
                    .filter(entry -> !entry.getKey().equals(insertedKey))
                    .sorted(Comparator.comparingLong(CacheEntry::getHitCount)
                            .thenComparing(CacheEntry::getCreatedAt))
                    .toList();
            for (CacheEntry candidate : candidates) {
                if (entries.size() <= maxEntries) {
                    break;
                }
                entries.remove(candidate.getKey());
                leastUsed++;
            }
        }
        evictions += expired + leastUsed;
        log.debug("[Cache] Evicted {} expired and {} least-used entries", expired, leastUsed);
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !now.isBefore(entry.getExpiresAt());
    }
}
