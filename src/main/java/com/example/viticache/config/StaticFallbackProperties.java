package com.example.viticache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fallback.static")
public class StaticFallbackProperties {

    /**
     * CSV 파일 디렉터리 (외부에서 채워지는 읽기 전용 자원)
     */
    private String directory = "data/fallback";

    /**
     * 파싱 결과 캐시 사용 여부
     */
    private boolean cacheEnabled = true;

    /**
     * 파싱 결과 캐시 최대 항목 수 (최소 1)
     */
    private int maxEntries = 100;

    /**
     * 파싱 결과 캐시 TTL (초, 최소 60)
     */
    private int ttlSeconds = 3_600;
}
