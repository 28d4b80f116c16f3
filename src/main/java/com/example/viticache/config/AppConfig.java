package com.example.viticache.config;

import com.example.viticache.cache.CacheStatistics;
import com.example.viticache.fallback.EndpointMapping;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 공용 Bean 구성
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStatistics cacheStatistics() {
        return new CacheStatistics();
    }

    @Bean
    public EndpointMapping endpointMapping() {
        return EndpointMapping.defaults();
    }

    /**
     * 원천 조회 전용 스레드 풀 (요청 스레드는 타임아웃까지만 대기)
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(CacheProperties cacheProperties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("viti-fetch-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, cacheProperties.getFetchThreads()), threadFactory);
    }

    @Bean
    public RestTemplate scraperRestTemplate(RestTemplateBuilder builder, ScraperProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }
}
