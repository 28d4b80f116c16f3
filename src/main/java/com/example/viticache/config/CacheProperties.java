package com.example.viticache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cache.tiers")
public class CacheProperties {

    /**
     * 단기 캐시 TTL (초) - 요청 폭주 흡수용
     */
    private int shortTtlSeconds = 300;

    /**
     * 장기(fallback) 캐시 TTL (초) - 원천 장애 대비, 기본 30일
     */
    private int fallbackTtlSeconds = 2_592_000;

    /**
     * 단기 캐시 키 prefix
     */
    private String shortPrefix = "short:";

    /**
     * 장기 캐시 키 prefix
     */
    private String fallbackPrefix = "fallback:";

    /**
     * 원천 조회 타임아웃 (밀리초)
     */
    private int fetchTimeoutMs = 30_000;

    /**
     * 원천 조회 스레드 수
     */
    private int fetchThreads = 8;

    /**
     * Redis 장애 감지 후 재시도까지 대기 시간 (밀리초)
     */
    private int storeReprobeIntervalMs = 2_000;
}
