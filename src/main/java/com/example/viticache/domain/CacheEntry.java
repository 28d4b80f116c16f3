package com.example.viticache.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * 해석 결과 (payload + 출처 태그 + 저장 시각)
 * Coordinator가 생성하며 생성 이후 변경되지 않는다
 */
@Value
public class CacheEntry {

    @NonNull
    TableRecord payload;

    @NonNull
    Provenance provenance;

    @NonNull
    Instant storedAt;
}
