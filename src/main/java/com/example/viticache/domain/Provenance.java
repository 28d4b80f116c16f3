package com.example.viticache.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 응답 데이터가 어느 계층에서 왔는지 나타내는 태그
 * 응답 JSON의 "cached" 필드로 직렬화된다 (false | "short_term" | "fallback" | "csv_fallback")
 */
public enum Provenance {

    FRESH(Boolean.FALSE, "Fresh web scraping", "Real-time data"),
    SHORT_TERM("short_term", "Redis short_term cache", "Cached data"),
    LONG_TERM("fallback", "Redis fallback cache", "Cached data"),
    STATIC_FALLBACK("csv_fallback", "Local CSV files", "Static data from local files");

    private final Object cachedFlag;
    private final String dataSource;
    private final String freshness;

    Provenance(Object cachedFlag, String dataSource, String freshness) {
        this.cachedFlag = cachedFlag;
        this.dataSource = dataSource;
        this.freshness = freshness;
    }

    @JsonValue
    public Object cachedFlag() {
        return cachedFlag;
    }

    public String dataSource() {
        return dataSource;
    }

    public String freshness() {
        return freshness;
    }
}
