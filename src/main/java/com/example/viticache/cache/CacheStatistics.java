package com.example.viticache.cache;

import com.example.viticache.domain.Tier;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 계층별 히트/미스 카운터 (참고용, 정확성에 영향을 주지 않음)
 * 프로세스 전역 상태 대신 Bean으로 주입해서 테스트마다 독립적으로 쓸 수 있게 한다
 */
public class CacheStatistics {

    private final Map<Tier, LongAdder> hits = new EnumMap<>(Tier.class);
    private final Map<Tier, LongAdder> misses = new EnumMap<>(Tier.class);
    private final Map<Tier, LongAdder> unavailable = new EnumMap<>(Tier.class);
    private final Map<String, LongAdder> fetchFailures = new ConcurrentHashMap<>();
    private final LongAdder writeFailures = new LongAdder();
    private final LongAdder decodeErrors = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final LongAdder exhausted = new LongAdder();

    public CacheStatistics() {
        for (Tier tier : Tier.values()) {
            hits.put(tier, new LongAdder());
            misses.put(tier, new LongAdder());
            unavailable.put(tier, new LongAdder());
        }
    }

    public void recordHit(Tier tier) {
        hits.get(tier).increment();
    }

    public void recordMiss(Tier tier) {
        misses.get(tier).increment();
    }

    public void recordUnavailable(Tier tier) {
        unavailable.get(tier).increment();
    }

    public void recordFetchFailure(String type) {
        fetchFailures.computeIfAbsent(type, ignored -> new LongAdder()).increment();
    }

    public void recordWriteFailure() {
        writeFailures.increment();
    }

    public void recordDecodeError() {
        decodeErrors.increment();
    }

    public void recordEviction() {
        evictions.increment();
    }

    public void recordExpiration() {
        expirations.increment();
    }

    public void recordExhausted() {
        exhausted.increment();
    }

    public long hits(Tier tier) {
        return hits.get(tier).sum();
    }

    public long misses(Tier tier) {
        return misses.get(tier).sum();
    }

    public long evictions() {
        return evictions.sum();
    }

    public Snapshot snapshot() {
        Map<Tier, TierCounters> tiers = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            tiers.put(tier, new TierCounters(
                    hits.get(tier).sum(), misses.get(tier).sum(), unavailable.get(tier).sum()));
        }
        Map<String, Long> failures = new ConcurrentHashMap<>();
        fetchFailures.forEach((type, counter) -> failures.put(type, counter.sum()));
        return new Snapshot(
                Collections.unmodifiableMap(tiers),
                Collections.unmodifiableMap(failures),
                writeFailures.sum(),
                decodeErrors.sum(),
                evictions.sum(),
                expirations.sum(),
                exhausted.sum());
    }

    @Value
    public static class TierCounters {

        long hits;
        long misses;
        long unavailable;

        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }

    @Value
    public static class Snapshot {

        Map<Tier, TierCounters> tiers;
        Map<String, Long> fetchFailures;
        long writeFailures;
        long decodeErrors;
        long staticCacheEvictions;
        long staticCacheExpirations;
        long exhaustedRequests;
    }
}
