package com.example.viticache.service;

import com.example.viticache.cache.VolatileStoreClient;
import com.example.viticache.config.CacheProperties;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.Resolution;
import com.example.viticache.fallback.StaticFallbackStore;
import com.example.viticache.source.VitibrasilSourceClient;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 통계 조회/캐시 관리 서비스
 * 요청 파라미터를 Coordinator 입력으로 바꾸고, 원천 조회 동작을 연결한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViticultureDataService {

    private final TieredCacheCoordinator coordinator;
    private final VitibrasilSourceClient sourceClient;
    private final VolatileStoreClient store;
    private final StaticFallbackStore staticStore;
    private final CacheProperties cacheProperties;

    /**
     * 검증이 끝난 파라미터로 조회한다
     */
    public Resolution getData(Endpoint endpoint, Integer year, String subOption) {
        Map<String, String> params = new LinkedHashMap<>();
        if (year != null) {
            params.put(Endpoint.PARAM_YEAR, String.valueOf(year));
        }
        if (subOption != null) {
            params.put(Endpoint.PARAM_SUB_OPTION, subOption);
        }
        return coordinator.resolve(endpoint, params, sourceClient.fetcherFor(endpoint, year, subOption));
    }

    /**
     * Redis 계층 키와 정적 파싱 캐시를 비운다
     *
     * @param endpoint null 이면 전체 엔드포인트
     * @param type     short | fallback | all
     */
    public ClearResult clearCache(Endpoint endpoint, CacheType type) {
        String target = endpoint == null ? "*" : endpoint.path();
        long cleared = 0;
        boolean storeAvailable = true;
        for (String prefix : type.prefixes(cacheProperties)) {
            long deleted = store.deleteByPattern(prefix + target + ":*");
            if (deleted < 0) {
                storeAvailable = false;
            } else {
                cleared += deleted;
            }
        }
        int staticCleared = staticStore.clearCache();
        log.info("[캐시 삭제] endpoint={}, type={}, clearedKeys={}, storeAvailable={}",
                target, type.label(), cleared, storeAvailable);
        return new ClearResult(target, type.label(), cleared, staticCleared, storeAvailable);
    }

    public enum CacheType {
        SHORT,
        FALLBACK,
        ALL;

        public static Optional<CacheType> parse(String value) {
            if (value == null || value.isBlank()) {
                return Optional.of(ALL);
            }
            for (CacheType type : values()) {
                if (type.label().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        List<String> prefixes(CacheProperties properties) {
            List<String> prefixes = new ArrayList<>(2);
            if (this != FALLBACK) {
                prefixes.add(properties.getShortPrefix());
            }
            if (this != SHORT) {
                prefixes.add(properties.getFallbackPrefix());
            }
            return prefixes;
        }
    }

    @Value
    public static class ClearResult {

        String endpoint;
        String cacheType;
        long clearedKeys;
        int staticEntriesCleared;
        boolean storeAvailable;
    }
}
