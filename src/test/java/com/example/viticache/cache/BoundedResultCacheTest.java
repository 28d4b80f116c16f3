package com.example.viticache.cache;

import com.example.viticache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BoundedResultCache 테스트")
class BoundedResultCacheTest {

    private MutableClock clock;
    private CacheStatistics statistics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        statistics = new CacheStatistics();
    }

    private BoundedResultCache<String, String> cache(int capacity) {
        return new BoundedResultCache<>(capacity, Duration.ofMinutes(10), clock, statistics);
    }

    @Nested
    @DisplayName("1. LRU 제거")
    class Eviction {

        @Test
        @DisplayName("용량 N에 N+1개를 넣으면 가장 오래 사용하지 않은 항목 하나만 제거된다")
        void overflow_evictsLeastRecentlyUsed() {
            // given
            BoundedResultCache<String, String> cache = cache(3);
            cache.put("a", "A");
            cache.put("b", "B");
            cache.put("c", "C");

            // when
            cache.put("d", "D");

            // then
            assertThat(cache.size()).isEqualTo(3);
            assertThat(cache.get("a")).isEmpty();
            assertThat(cache.get("b")).contains("B");
            assertThat(cache.get("c")).contains("C");
            assertThat(cache.get("d")).contains("D");
            assertThat(statistics.evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("조회하면 최근 사용 순서가 갱신된다")
        void access_updatesRecency() {
            // given
            BoundedResultCache<String, String> cache = cache(2);
            cache.put("a", "A");
            cache.put("b", "B");
            cache.get("a");

            // when
            cache.put("c", "C");

            // then
            assertThat(cache.get("a")).contains("A");
            assertThat(cache.get("b")).isEmpty();
        }

        @Test
        @DisplayName("같은 키를 다시 넣으면 크기가 늘지 않는다")
        void overwrite_keepsSize() {
            BoundedResultCache<String, String> cache = cache(2);
            cache.put("a", "A1");
            cache.put("a", "A2");

            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.get("a")).contains("A2");
            assertThat(statistics.evictions()).isZero();
        }

        @Test
        @DisplayName("용량은 1 이상이어야 한다")
        void capacity_mustBePositive() {
            assertThatThrownBy(() -> cache(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("2. TTL")
    class Expiry {

        @Test
        @DisplayName("TTL이 지난 항목은 없는 것으로 취급하고 조회 시 제거한다")
        void expiredEntry_treatedAsAbsent() {
            // given
            BoundedResultCache<String, String> cache = cache(5);
            cache.put("a", "A");

            // when
            clock.advance(Duration.ofMinutes(11));

            // then
            assertThat(cache.get("a")).isEmpty();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("TTL 이전에는 그대로 조회된다")
        void freshEntry_returned() {
            BoundedResultCache<String, String> cache = cache(5);
            cache.put("a", "A");

            clock.advance(Duration.ofMinutes(9));

            assertThat(cache.get("a")).contains("A");
        }

        @Test
        @DisplayName("purgeExpired는 만료된 항목만 지운다")
        void purgeExpired_removesOnlyExpired() {
            BoundedResultCache<String, String> cache = cache(5);
            cache.put("old", "O");
            clock.advance(Duration.ofMinutes(6));
            cache.put("new", "N");
            clock.advance(Duration.ofMinutes(5));

            int removed = cache.purgeExpired();

            assertThat(removed).isEqualTo(1);
            assertThat(cache.get("new")).contains("N");
        }
    }

    @Test
    @DisplayName("clear는 지운 항목 수를 돌려준다")
    void clear_returnsRemovedCount() {
        BoundedResultCache<String, String> cache = cache(5);
        cache.put("a", "A");
        cache.put("b", "B");

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }
}
