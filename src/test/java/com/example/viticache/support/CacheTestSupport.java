package com.example.viticache.support;

import com.example.viticache.cache.CacheKeyBuilder;
import com.example.viticache.cache.CacheStatistics;
import com.example.viticache.cache.VolatileStoreClient;
import com.example.viticache.config.CacheProperties;
import com.example.viticache.service.TieredCacheCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Embedded Redis 위에서 계층 동작을 확인하는 테스트의 공통 설정
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class CacheTestSupport {

    @Autowired
    protected TieredCacheCoordinator coordinator;

    @Autowired
    protected VolatileStoreClient store;

    @Autowired
    protected CacheKeyBuilder keyBuilder;

    @Autowired
    protected CacheProperties cacheProperties;

    @Autowired
    protected CacheStatistics statistics;

    @Autowired
    protected StringRedisTemplate redisTemplate;

    @BeforeEach
    void setUp() {
        // Redis가 없으면 건너뛰지 않고 실패시킨다
        assertThat(store.ping()).as("embedded redis must be reachable").isTrue();
        redisTemplate.getConnectionFactory().getConnection().serverCommands().flushAll();
    }

    protected void runConcurrent(int tasks, int threads, Runnable action) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(tasks);

        for (int i = 0; i < tasks; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    action.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        boolean completed = endLatch.await(30, TimeUnit.SECONDS);
        executor.shutdown();
        if (!completed) {
            throw new IllegalStateException("Concurrent run timed out");
        }
    }
}
