package com.example.viticache.service;

import com.example.viticache.cache.CacheStatistics;
import com.example.viticache.cache.VolatileStoreClient;
import com.example.viticache.config.CacheProperties;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.fallback.InventoryReport;
import com.example.viticache.fallback.StaticFallbackStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 운영 상태 리포트
 * 조회 경로와 분리되어 있으며, 하위 구성요소가 실패해도 예외 대신 필드 값으로 보고한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthReportService {

    /**
     * 503 응답에 붙이는 인벤토리 상태를 다시 점검하기까지의 간격
     */
    static final long INVENTORY_REFRESH_MS = 60_000;

    private final VolatileStoreClient store;
    private final StaticFallbackStore staticStore;
    private final CacheStatistics statistics;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    private final AtomicReference<InventorySnapshot> lastInventory = new AtomicReference<>();

    public Map<String, Object> heartbeat() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("redis", redisStatus());
        body.put("csv_fallback", staticStore.isAvailable() ? "available" : "unavailable");
        return body;
    }

    /**
     * 503 응답에 붙이는 간단한 시스템 상태
     * Redis는 클라이언트가 이미 알고 있는 장애 상태만 보고, 인벤토리는 최근 점검 결과를 재사용한다
     */
    public Map<String, Object> systemStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("redis", store.isMarkedDown() ? "disconnected" : "connected");
        status.put("csv_fallback", staticStore.isAvailable() ? "available" : "unavailable");
        try {
            status.put("static_inventory", recentInventory().status().label());
        } catch (RuntimeException e) {
            log.warn("[상태 점검 실패] 정적 인벤토리 - reason={}", e.getMessage());
            status.put("static_inventory", "error: " + e.getMessage());
        }
        return status;
    }

    public Map<String, Object> report() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp", Instant.now(clock).toString());
        report.put("redis", redisReport());
        report.put("tiers", statistics.snapshot());
        report.put("static_cache", staticCacheReport());
        report.put("static_inventory", inventoryReport());
        return report;
    }

    private String redisStatus() {
        try {
            return store.ping() ? "connected" : "disconnected";
        } catch (RuntimeException e) {
            log.warn("[상태 점검 실패] redis ping - reason={}", e.getMessage());
            return "disconnected";
        }
    }

    private Map<String, Object> redisReport() {
        Map<String, Object> redis = new LinkedHashMap<>();
        String status = redisStatus();
        redis.put("status", status);
        redis.put("short_ttl_seconds", cacheProperties.getShortTtlSeconds());
        redis.put("fallback_ttl_seconds", cacheProperties.getFallbackTtlSeconds());
        if (!"connected".equals(status)) {
            return redis;
        }

        Map<String, Object> keys = new LinkedHashMap<>();
        for (Endpoint endpoint : Endpoint.values()) {
            Map<String, Object> counts = new LinkedHashMap<>();
            counts.put("short", count(cacheProperties.getShortPrefix() + endpoint.path() + ":*"));
            counts.put("fallback", count(cacheProperties.getFallbackPrefix() + endpoint.path() + ":*"));
            keys.put(endpoint.path(), counts);
        }
        redis.put("keys", keys);
        redis.put("total_short_keys", count(cacheProperties.getShortPrefix() + "*"));
        redis.put("total_fallback_keys", count(cacheProperties.getFallbackPrefix() + "*"));
        return redis;
    }

    private Object count(String pattern) {
        return store.countKeys(pattern).<Object>map(count -> count).orElse("unavailable");
    }

    private Map<String, Object> staticCacheReport() {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("enabled", staticStore.isCacheEnabled());
        cache.put("size", staticStore.cacheSize());
        cache.put("max_size", staticStore.cacheCapacity());
        cache.put("ttl_seconds", staticStore.cacheTtlSeconds());
        cache.put("evictions", statistics.evictions());
        return cache;
    }

    private Object inventoryReport() {
        try {
            InventoryReport inventory = refreshInventory();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", inventory.status().label());
            body.put("directory", inventory.getDirectory());
            body.put("directory_exists", inventory.isDirectoryExists());
            body.put("total_sources", inventory.totalSources());
            body.put("usable_sources", inventory.usableSources());
            body.put("sources", inventory.getSources());
            return body;
        } catch (RuntimeException e) {
            log.warn("[상태 점검 실패] 정적 인벤토리 - reason={}", e.getMessage());
            return Map.of("status", "error", "error", String.valueOf(e.getMessage()));
        }
    }

    private InventoryReport recentInventory() {
        InventorySnapshot snapshot = lastInventory.get();
        if (snapshot != null && clock.millis() - snapshot.takenAtMs() < INVENTORY_REFRESH_MS) {
            return snapshot.report();
        }
        return refreshInventory();
    }

    private InventoryReport refreshInventory() {
        InventoryReport report = staticStore.validateInventory();
        lastInventory.set(new InventorySnapshot(report, clock.millis()));
        return report;
    }

    private record InventorySnapshot(InventoryReport report, long takenAtMs) {
    }
}
