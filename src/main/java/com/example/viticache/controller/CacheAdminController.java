package com.example.viticache.controller;

import com.example.viticache.domain.Endpoint;
import com.example.viticache.service.HealthReportService;
import com.example.viticache.service.ViticultureDataService;
import com.example.viticache.service.ViticultureDataService.CacheType;
import com.example.viticache.service.ViticultureDataService.ClearResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 점검 / 캐시 관리 API
 */
@RestController
@RequiredArgsConstructor
public class CacheAdminController {

    private final HealthReportService healthReportService;
    private final ViticultureDataService dataService;

    /**
     * 인증 없이 호출 가능한 생존 확인
     */
    @GetMapping("/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat() {
        return ResponseEntity.ok(healthReportService.heartbeat());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(healthReportService.report());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clear(@RequestParam(required = false) String endpoint,
                                                     @RequestParam(required = false) String type) {
        Endpoint target = null;
        if (endpoint != null && !endpoint.isBlank()) {
            target = Endpoint.fromPath(endpoint).orElseThrow(() -> new InvalidParameterException(
                    "cache", "Endpoint inválido: " + endpoint, params(endpoint, type)));
        }
        CacheType cacheType = CacheType.parse(type).orElseThrow(() -> new InvalidParameterException(
                "cache", "Tipo de cache inválido. Opções válidas: short, fallback, all", params(endpoint, type)));

        ClearResult result = dataService.clearCache(target, cacheType);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("endpoint", result.getEndpoint());
        body.put("cache_type", result.getCacheType());
        body.put("cleared_keys", result.getClearedKeys());
        body.put("static_entries_cleared", result.getStaticEntriesCleared());
        if (!result.isStoreAvailable()) {
            body.put("status", "redis_unavailable");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        body.put("status", "success");
        return ResponseEntity.ok(body);
    }

    private Map<String, String> params(String endpoint, String type) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("endpoint", endpoint);
        params.put("type", type);
        return params;
    }
}
