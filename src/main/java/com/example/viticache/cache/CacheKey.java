package com.example.viticache.cache;

import lombok.NonNull;
import lombok.Value;

/**
 * 엔드포인트 + 정규화된 파라미터로 만든 계층 무관(tier-agnostic) 캐시 키
 * 계층별 prefix는 Coordinator가 붙인다
 */
@Value
public class CacheKey {

    @NonNull
    String value;

    public String withPrefix(String prefix) {
        return prefix + value;
    }

    @Override
    public String toString() {
        return value;
    }
}
