package com.example.viticache.service;

import com.example.viticache.cache.CacheKey;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.Provenance;
import com.example.viticache.domain.Resolution;
import com.example.viticache.domain.RowGroup;
import com.example.viticache.domain.TableRecord;
import com.example.viticache.domain.Tier;
import com.example.viticache.source.FetchError;
import com.example.viticache.source.FetchResult;
import com.example.viticache.source.LiveFetch;
import com.example.viticache.support.CacheTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/*
 * Embedded Redis 위에서 계층 순서를 끝까지 따라가는 시나리오
 * - 원천 조회는 호출 횟수를 세는 LiveFetch로 대체한다
 * - 정적 파일은 src/test/resources/fallback 을 사용한다
 */
@DisplayName("계층 해석 시나리오 테스트")
class TieredResolutionScenarioTest extends CacheTestSupport {

    private static final Map<String, String> YEAR_2023 = Map.of("year", "2023");

    private AtomicInteger fetchCount;

    @BeforeEach
    void resetCount() {
        fetchCount = new AtomicInteger();
    }

    @Test
    @DisplayName("첫 요청은 원천, 두 번째 요청은 단기 캐시에서 응답한다")
    void freshThenShortTerm() {
        // 실행
        Resolution first = coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, succeeding());
        Resolution second = coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, succeeding());

        // 검증: 원천은 한 번만 호출되고 두 계층 모두 채워진다
        assertThat(first.entry().getProvenance()).isEqualTo(Provenance.FRESH);
        assertThat(second.entry().getProvenance()).isEqualTo(Provenance.SHORT_TERM);
        assertThat(second.entry().getPayload()).isEqualTo(first.entry().getPayload());
        assertThat(fetchCount.get()).isEqualTo(1);

        CacheKey key = keyBuilder.build(Endpoint.PRODUCAO, YEAR_2023);
        assertThat(store.ttlSeconds(key.withPrefix(cacheProperties.getShortPrefix())))
                .hasValueSatisfying(ttl -> assertThat(ttl).isBetween(1L, (long) cacheProperties.getShortTtlSeconds()));
        assertThat(store.ttlSeconds(key.withPrefix(cacheProperties.getFallbackPrefix())))
                .hasValueSatisfying(ttl -> assertThat(ttl).isGreaterThan(cacheProperties.getShortTtlSeconds()));
    }

    @Test
    @DisplayName("단기 캐시가 사라진 뒤 원천이 실패하면 장기 캐시로 응답한다")
    void fetchFailure_servedFromLongTerm() {
        // 준비: 한 번 성공시켜 두 계층을 채운 뒤 단기 키만 지운다
        coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, succeeding());
        CacheKey key = keyBuilder.build(Endpoint.PRODUCAO, YEAR_2023);
        redisTemplate.delete(key.withPrefix(cacheProperties.getShortPrefix()));

        // 실행
        Resolution resolution = coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, failing());

        // 검증
        assertThat(resolution.entry().getProvenance()).isEqualTo(Provenance.LONG_TERM);
        assertThat(resolution.entry().getPayload().getBody().get(0).getItemData()).containsExactly("VINHO DE MESA", "1");
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Redis에 아무것도 없고 원천이 실패하면 정적 파일로 응답한다")
    void fetchFailure_servedFromStaticFile() {
        // 실행
        Resolution resolution = coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, failing());

        // 검증: 정적 응답은 Redis에 다시 쓰지 않는다
        assertThat(resolution.entry().getProvenance()).isEqualTo(Provenance.STATIC_FALLBACK);
        assertThat(resolution.entry().getPayload().getHeader()).isNotEmpty();
        CacheKey key = keyBuilder.build(Endpoint.PRODUCAO, YEAR_2023);
        assertThat(redisTemplate.hasKey(key.withPrefix(cacheProperties.getShortPrefix()))).isFalse();
        assertThat(redisTemplate.hasKey(key.withPrefix(cacheProperties.getFallbackPrefix()))).isFalse();
    }

    @Test
    @DisplayName("정적 파일도 없으면 계층별 사유와 함께 소진된다")
    void allTiersFail_unavailable() {
        // comercializacao 정적 파일은 테스트 디렉토리에 없다
        Resolution resolution = coordinator.resolve(Endpoint.COMERCIALIZACAO, YEAR_2023, failing());

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.unavailable().getAttempts())
                .extracting(attempt -> attempt.getTier())
                .containsExactly(Tier.SHORT_TERM, Tier.LIVE_FETCH, Tier.LONG_TERM, Tier.STATIC_FALLBACK);
        assertThat(resolution.unavailable().getRequestedParams()).containsEntry("year", "2023");
    }

    @Test
    @DisplayName("서로 다른 파라미터는 서로의 캐시를 침범하지 않는다")
    void differentParams_isolated() {
        coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, succeeding());

        Resolution other = coordinator.resolve(Endpoint.PRODUCAO, Map.of("year", "2022"), succeeding());

        assertThat(other.entry().getProvenance()).isEqualTo(Provenance.FRESH);
        assertThat(fetchCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("동시 요청은 모두 같은 payload를 받는다")
    void concurrentRequests_consistentPayload() throws InterruptedException {
        ConcurrentLinkedQueue<TableRecord> payloads = new ConcurrentLinkedQueue<>();

        runConcurrent(50, 10, () ->
                payloads.add(coordinator.resolve(Endpoint.PRODUCAO, YEAR_2023, succeeding()).entry().getPayload()));

        // 요청 병합은 하지 않으므로 원천 호출 횟수는 1 이상, 결과는 모두 동일해야 한다
        assertThat(payloads).hasSize(50);
        assertThat(payloads).containsOnly(sampleRecord());
        assertThat(fetchCount.get()).isBetween(1, 50);
    }

    private LiveFetch succeeding() {
        return () -> {
            fetchCount.incrementAndGet();
            return FetchResult.success(sampleRecord());
        };
    }

    private LiveFetch failing() {
        return () -> {
            fetchCount.incrementAndGet();
            return FetchResult.failure(FetchError.Type.NETWORK, "connection refused");
        };
    }

    private static TableRecord sampleRecord() {
        return TableRecord.builder()
                .headerRow(List.of("Produto", "Quantidade (L.)"))
                .bodyGroup(RowGroup.of(List.of("VINHO DE MESA", "1")))
                .footerRow(List.of("Total", "1"))
                .build();
    }
}
