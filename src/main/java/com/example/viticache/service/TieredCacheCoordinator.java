package com.example.viticache.service;

import com.example.viticache.cache.CacheKey;
import com.example.viticache.cache.CacheKeyBuilder;
import com.example.viticache.cache.CacheStatistics;
import com.example.viticache.cache.StoreResult;
import com.example.viticache.cache.VolatileStoreClient;
import com.example.viticache.config.CacheProperties;
import com.example.viticache.domain.CacheEntry;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.Provenance;
import com.example.viticache.domain.Resolution;
import com.example.viticache.domain.TableRecord;
import com.example.viticache.domain.Tier;
import com.example.viticache.domain.TierAttempt;
import com.example.viticache.domain.Unavailable;
import com.example.viticache.fallback.StaticFallbackStore;
import com.example.viticache.source.FetchError;
import com.example.viticache.source.FetchResult;
import com.example.viticache.source.LiveFetch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 계층형 캐시 조회
 *
 * 조회 순서 (첫 성공에서 종료):
 * 1. 단기 캐시 (short:, 기본 5분) - 요청 폭주 흡수
 * 2. 원천 조회 - 성공 시 단기/장기 캐시에 best-effort 저장
 * 3. 장기 캐시 (fallback:, 기본 30일) - 원천 장애 대비
 * 4. 정적 CSV - Redis와 원천이 동시에 죽어도 응답
 *
 * 각 계층의 실패는 다음 계층으로 넘어가는 신호일 뿐이며, 모든 계층이 실패했을 때만 Unavailable
 */
@Slf4j
@Service
public class TieredCacheCoordinator {

    private final CacheKeyBuilder keyBuilder;
    private final VolatileStoreClient store;
    private final StaticFallbackStore staticStore;
    private final CacheStatistics statistics;
    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    public TieredCacheCoordinator(CacheKeyBuilder keyBuilder,
                                  VolatileStoreClient store,
                                  StaticFallbackStore staticStore,
                                  CacheStatistics statistics,
                                  CacheProperties cacheProperties,
                                  ObjectMapper objectMapper,
                                  @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                                  Clock clock) {
        this.keyBuilder = keyBuilder;
        this.store = store;
        this.staticStore = staticStore;
        this.statistics = statistics;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    public Resolution resolve(Endpoint endpoint, Map<String, String> params, LiveFetch fetch) {
        CacheKey key = keyBuilder.build(endpoint, params);
        List<TierAttempt> attempts = new ArrayList<>(Tier.values().length);

        for (Tier tier : Tier.values()) {
            Optional<CacheEntry> entry;
            switch (tier) {
                case SHORT_TERM:
                    entry = readTier(tier, cacheProperties.getShortPrefix(), key, Provenance.SHORT_TERM, attempts);
                    break;
                case LIVE_FETCH:
                    entry = fetchAndWarm(endpoint, key, fetch, attempts);
                    break;
                case LONG_TERM:
                    entry = readTier(tier, cacheProperties.getFallbackPrefix(), key, Provenance.LONG_TERM, attempts);
                    break;
                case STATIC_FALLBACK:
                    entry = readStatic(endpoint, params, attempts);
                    break;
                default:
                    throw new IllegalStateException("unknown tier: " + tier);
            }
            if (entry.isPresent()) {
                return Resolution.resolved(entry.get(), attempts);
            }
        }

        statistics.recordExhausted();
        Unavailable unavailable = new Unavailable(endpoint, requestedParams(params), attempts);
        log.error("[전체 계층 소진] endpoint={}, key={}, attempts={}", endpoint, key, unavailable.summary());
        return Resolution.unavailable(unavailable);
    }

    private Optional<CacheEntry> readTier(Tier tier, String prefix, CacheKey key,
                                          Provenance provenance, List<TierAttempt> attempts) {
        String storeKey = key.withPrefix(prefix);
        StoreResult<String> result = store.get(storeKey);

        if (result.isUnavailable()) {
            statistics.recordUnavailable(tier);
            attempts.add(TierAttempt.unavailable(tier, result.reason()));
            log.debug("[{} 사용 불가] key={}, reason={}", tier.description(), storeKey, result.reason());
            return Optional.empty();
        }
        if (!result.isHit()) {
            statistics.recordMiss(tier);
            attempts.add(TierAttempt.miss(tier, "key not found"));
            log.debug("[{} 미스] key={}", tier.description(), storeKey);
            return Optional.empty();
        }

        Optional<StoredEntry> decoded = decode(storeKey, result.value().orElse(""));
        if (decoded.isEmpty()) {
            statistics.recordMiss(tier);
            attempts.add(TierAttempt.miss(tier, "undecodable payload"));
            return Optional.empty();
        }

        statistics.recordHit(tier);
        attempts.add(TierAttempt.hit(tier));
        log.debug("[{} 히트] key={}", tier.description(), storeKey);
        StoredEntry stored = decoded.get();
        return Optional.of(new CacheEntry(stored.payload(), provenance, Instant.ofEpochMilli(stored.storedAtMs())));
    }

    private Optional<CacheEntry> fetchAndWarm(Endpoint endpoint, CacheKey key, LiveFetch fetch,
                                              List<TierAttempt> attempts) {
        FetchResult result = runFetch(fetch);
        if (!result.isSuccess()) {
            FetchError error = result.error();
            statistics.recordMiss(Tier.LIVE_FETCH);
            statistics.recordFetchFailure(error.getType().name());
            attempts.add(TierAttempt.failed(Tier.LIVE_FETCH, error.toString()));
            log.warn("[원천 조회 실패] endpoint={}, type={}, message={}",
                    endpoint, error.getType(), error.getMessage());
            return Optional.empty();
        }

        statistics.recordHit(Tier.LIVE_FETCH);
        attempts.add(TierAttempt.hit(Tier.LIVE_FETCH));
        CacheEntry entry = new CacheEntry(result.record(), Provenance.FRESH, clock.instant());
        warm(key, entry);
        log.info("[원천 조회 성공] endpoint={}, key={}", endpoint, key);
        return Optional.of(entry);
    }

    private Optional<CacheEntry> readStatic(Endpoint endpoint, Map<String, String> params,
                                            List<TierAttempt> attempts) {
        // 키와 같은 정규화 결과에서 꺼내야 " SUB_OPTION " 같은 이름도 같은 파일로 간다
        String subOption = keyBuilder.canonicalize(endpoint, params).get(Endpoint.PARAM_SUB_OPTION);
        Optional<TableRecord> record;
        try {
            record = staticStore.lookup(endpoint, subOption);
        } catch (RuntimeException e) {
            log.error("[정적 fallback 오류] endpoint={}, subOption={}", endpoint, subOption, e);
            record = Optional.empty();
        }

        if (record.isEmpty()) {
            statistics.recordMiss(Tier.STATIC_FALLBACK);
            attempts.add(TierAttempt.miss(Tier.STATIC_FALLBACK, "no static source for " + endpoint));
            return Optional.empty();
        }

        statistics.recordHit(Tier.STATIC_FALLBACK);
        attempts.add(TierAttempt.hit(Tier.STATIC_FALLBACK));
        log.info("[정적 fallback 히트] endpoint={}, subOption={}", endpoint, subOption);
        return Optional.of(new CacheEntry(record.get(), Provenance.STATIC_FALLBACK, clock.instant()));
    }

    /**
     * 타임아웃이 걸린 원천 조회, 어떤 경우에도 예외를 던지지 않는다
     */
    private FetchResult runFetch(LiveFetch fetch) {
        Future<FetchResult> future;
        try {
            future = fetchExecutor.submit(fetch::fetch);
        } catch (RejectedExecutionException e) {
            return FetchResult.failure(FetchError.Type.UNEXPECTED, "fetch executor rejected task");
        }

        long timeoutMs = cacheProperties.getFetchTimeoutMs();
        try {
            FetchResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : FetchResult.failure(FetchError.Type.UNEXPECTED, "fetch returned null");
        } catch (TimeoutException e) {
            future.cancel(true);
            return FetchResult.failure(FetchError.Type.TIMEOUT, "no response within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return FetchResult.failure(FetchError.Type.CANCELLED, "request interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return FetchResult.failure(FetchError.Type.UNEXPECTED,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private void warm(CacheKey key, CacheEntry entry) {
        String encoded;
        try {
            encoded = objectMapper.writeValueAsString(
                    new StoredEntry(entry.getPayload(), entry.getStoredAt().toEpochMilli()));
        } catch (JsonProcessingException e) {
            statistics.recordWriteFailure();
            log.warn("[캐시 저장 실패] 직렬화 오류 - key={}, reason={}", key, e.getMessage());
            return;
        }
        write(key.withPrefix(cacheProperties.getShortPrefix()), encoded,
                Duration.ofSeconds(cacheProperties.getShortTtlSeconds()));
        write(key.withPrefix(cacheProperties.getFallbackPrefix()), encoded,
                Duration.ofSeconds(cacheProperties.getFallbackTtlSeconds()));
    }

    private void write(String storeKey, String encoded, Duration ttl) {
        if (store.set(storeKey, encoded, ttl)) {
            log.debug("[캐시 저장] key={}, ttl={}s", storeKey, ttl.getSeconds());
        } else {
            statistics.recordWriteFailure();
            log.debug("[캐시 저장 실패] key={}", storeKey);
        }
    }

    private Optional<StoredEntry> decode(String storeKey, String raw) {
        try {
            StoredEntry stored = objectMapper.readValue(raw, StoredEntry.class);
            if (stored == null || stored.payload() == null) {
                statistics.recordDecodeError();
                return Optional.empty();
            }
            return Optional.of(stored);
        } catch (JsonProcessingException e) {
            statistics.recordDecodeError();
            log.warn("[캐시 역직렬화 실패] key={}, reason={}", storeKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Map<String, String> requestedParams(Map<String, String> params) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Redis에 저장되는 형태 (provenance는 읽은 계층으로 결정되므로 저장하지 않는다)
     */
    record StoredEntry(TableRecord payload, long storedAtMs) {
    }
}
