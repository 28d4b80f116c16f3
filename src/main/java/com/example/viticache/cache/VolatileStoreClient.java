package com.example.viticache.cache;

import com.example.viticache.config.CacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Redis 접근 래퍼
 * - 연결 실패(DataAccessException)를 예외 대신 UNAVAILABLE / false 로 변환
 * - 장애 감지 후 reprobe 간격 동안은 Redis를 건드리지 않고 바로 UNAVAILABLE
 * - 간격이 지나면 다음 호출에서 자동으로 재시도 (영구 차단 상태 없음)
 */
@Slf4j
@Component
public class VolatileStoreClient {

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final long reprobeIntervalMs;

    // 0 이면 정상, 그 외에는 이 시각(ms)까지 호출을 건너뛴다
    private final AtomicLong downUntil = new AtomicLong(0);

    public VolatileStoreClient(StringRedisTemplate redisTemplate, CacheProperties cacheProperties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.reprobeIntervalMs = cacheProperties.getStoreReprobeIntervalMs();
    }

    public StoreResult<String> get(String key) {
        if (inOutageWindow()) {
            return StoreResult.unavailable("redis marked down");
        }
        try {
            String value = redisTemplate.opsForValue().get(key);
            markUp();
            return value == null ? StoreResult.miss() : StoreResult.hit(value);
        } catch (DataAccessException e) {
            markDown("get", e);
            return StoreResult.unavailable(e.getClass().getSimpleName());
        }
    }

    public boolean set(String key, String value, Duration ttl) {
        if (inOutageWindow()) {
            return false;
        }
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            markUp();
            return true;
        } catch (DataAccessException e) {
            markDown("set", e);
            return false;
        }
    }

    /**
     * 패턴에 맞는 키를 모두 삭제한다
     *
     * @return 삭제된 키 수, Redis 사용 불가 시 -1
     */
    public long deleteByPattern(String pattern) {
        if (inOutageWindow()) {
            return -1;
        }
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            markUp();
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (DataAccessException e) {
            markDown("delete", e);
            return -1;
        }
    }

    /**
     * @return 패턴에 맞는 키 수, Redis 사용 불가 시 empty
     */
    public Optional<Long> countKeys(String pattern) {
        return query("keys", () -> {
            Set<String> keys = redisTemplate.keys(pattern);
            return keys == null ? 0L : (long) keys.size();
        });
    }

    /**
     * @return 남은 TTL(초), 키가 없으면 -2, 만료 없음이면 -1 (Redis TTL 규약)
     */
    public Optional<Long> ttlSeconds(String key) {
        return query("ttl", () -> redisTemplate.getExpire(key, TimeUnit.SECONDS));
    }

    /**
     * 상태 점검용 PING, reprobe 창을 무시하고 항상 실제로 확인한다
     */
    public boolean ping() {
        RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
        if (factory == null) {
            return false;
        }
        try (RedisConnection connection = factory.getConnection()) {
            String pong = connection.ping();
            markUp();
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            markDown("ping", e);
            return false;
        }
    }

    public boolean isMarkedDown() {
        return inOutageWindow();
    }

    private <T> Optional<T> query(String operation, Supplier<T> call) {
        if (inOutageWindow()) {
            return Optional.empty();
        }
        try {
            T result = call.get();
            markUp();
            return Optional.ofNullable(result);
        } catch (DataAccessException e) {
            markDown(operation, e);
            return Optional.empty();
        }
    }

    private boolean inOutageWindow() {
        long until = downUntil.get();
        return until != 0 && clock.millis() < until;
    }

    private void markUp() {
        if (downUntil.getAndSet(0) != 0) {
            log.info("[Redis 복구] 저장소 연결 재개");
        }
    }

    private void markDown(String operation, DataAccessException e) {
        long previous = downUntil.getAndSet(clock.millis() + reprobeIntervalMs);
        // 장애 구간마다 한 번만 WARN
        if (previous == 0) {
            log.warn("[Redis 사용 불가] operation={}, reason={}", operation, e.getMessage());
        } else {
            log.debug("[Redis 사용 불가] operation={}, reason={}", operation, e.getMessage());
        }
    }
}
