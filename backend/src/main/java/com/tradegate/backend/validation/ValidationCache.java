package com.tradegate.backend.validation;

import com.tradegate.backend.config.GateProperties;
import com.tradegate.backend.model.Claim;
import com.tradegate.backend.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Memoizes claim verdicts per trading day. Each day is its own LRU shard; only the
 * most recent {@code cache-retained-days} shards survive a rotation.
 */
@Slf4j
@Component
public class ValidationCache {

    private final int capacity;
    private final int retainedDays;
    private final ReentrantLock lock = new ReentrantLock();
    private final TreeMap<LocalDate, Map<String, ValidationResult>> shards = new TreeMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ValidationCache(GateProperties gateProperties) {
        this.capacity = gateProperties.getFactCheck().getCacheCapacity();
        this.retainedDays = gateProperties.getFactCheck().getCacheRetainedDays();
    }

    public record CacheStats(long hits, long misses, int size, int days) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }

    public Optional<ValidationResult> get(String assetId, Claim claim, LocalDate date) {
        String key = key(assetId, claim.text(), date);
        lock.lock();
        try {
            Map<String, ValidationResult> shard = shards.get(date);
            ValidationResult cached = shard == null ? null : shard.get(key);
            if (cached == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(cached);
        } finally {
            lock.unlock();
        }
    }

    public void put(String assetId, Claim claim, LocalDate date, ValidationResult result) {
        String key = key(assetId, claim.text(), date);
        lock.lock();
        try {
            shards.computeIfAbsent(date, ignored -> newShard()).put(key, result);
            trim(date);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes {@code date} the current day and drops shards that fall out of retention.
     */
    public void rotateTo(LocalDate date) {
        lock.lock();
        try {
            trim(date);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Scheduled retention sweep, anchored on the newest cached day rather than the wall clock
     * so that replays of historical dates keep their current shard.
     */
    @Scheduled(cron = "${gate.fact-check.cache-rotation-cron:0 0 0 * * *}")
    public void rotateDaily() {
        lock.lock();
        try {
            if (shards.isEmpty()) {
                return;
            }
            LocalDate newest = shards.lastKey();
            int before = shards.size();
            trim(newest);
            log.info("Validation cache rotated around {}: dropped {} day shard(s)", newest, before - shards.size());
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            shards.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            int size = shards.values().stream().mapToInt(Map::size).sum();
            return new CacheStats(hits.get(), misses.get(), size, shards.size());
        } finally {
            lock.unlock();
        }
    }

    static String key(String assetId, String claimText, LocalDate date) {
        String raw = assetId + '\u0000' + claimText + '\u0000' + date;
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    // Caller holds the lock. The current day counts towards retention and is never dropped.
    private void trim(LocalDate current) {
        List<LocalDate> others = new ArrayList<>(shards.descendingKeySet());
        others.remove(current);
        for (int i = Math.max(0, retainedDays - 1); i < others.size(); i++) {
            shards.remove(others.get(i));
        }
    }

    private Map<String, ValidationResult> newShard() {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ValidationResult> eldest) {
                return size() > capacity;
            }
        };
    }
}
