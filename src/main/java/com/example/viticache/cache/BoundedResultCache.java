package com.example.viticache.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 용량 제한 LRU 캐시 + 항목별 TTL (lazy expiry)
 * - LinkedHashMap(accessOrder=true)로 최근 사용 순서 유지
 * - 순서/멤버십 변경은 lock 안에서만, 저장된 값 자체는 불변으로 취급
 * - TTL이 지난 항목은 물리적으로 남아 있어도 조회 시 없는 것으로 본다
 */
@Slf4j
public class BoundedResultCache<K, V> {

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final CacheStatistics statistics;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, Slot<V>> map = new LinkedHashMap<>(16, 0.75f, true);

    public BoundedResultCache(int maxEntries, Duration ttl, Clock clock, CacheStatistics statistics) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = clock;
        this.statistics = statistics;
    }

    public Optional<V> get(K key) {
        lock.lock();
        try {
            Slot<V> slot = map.get(key);
            if (slot == null) {
                return Optional.empty();
            }
            if (isExpired(slot)) {
                map.remove(key);
                statistics.recordExpiration();
                log.debug("[정적 캐시 만료] key={}", key);
                return Optional.empty();
            }
            return Optional.of(slot.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        lock.lock();
        try {
            map.put(key, new Slot<>(value, clock.millis()));
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(K key) {
        lock.lock();
        try {
            return map.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public int clear() {
        lock.lock();
        try {
            int size = map.size();
            map.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료된 항목을 실제로 제거한다
     *
     * @return 제거된 항목 수
     */
    public int purgeExpired() {
        lock.lock();
        try {
            int before = map.size();
            map.values().removeIf(this::isExpired);
            int removed = before - map.size();
            for (int i = 0; i < removed; i++) {
                statistics.recordExpiration();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxEntries() {
        return maxEntries;
    }

    public Duration ttl() {
        return ttl;
    }

    private void evictIfNeeded() {
        // 가장 오래 전에 접근한 항목부터 제거
        while (map.size() > maxEntries) {
            Iterator<Map.Entry<K, Slot<V>>> it = map.entrySet().iterator();
            if (!it.hasNext()) {
                break;
            }
            Map.Entry<K, Slot<V>> eldest = it.next();
            it.remove();
            statistics.recordEviction();
            log.debug("[정적 캐시 LRU 제거] key={}", eldest.getKey());
        }
    }

    private boolean isExpired(Slot<V> slot) {
        return clock.millis() - slot.storedAtMs() > ttl.toMillis();
    }

    private record Slot<V>(V value, long storedAtMs) {
    }
}
