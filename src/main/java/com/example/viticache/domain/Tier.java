package com.example.viticache.domain;

/**
 * 해석 시 조회하는 계층, 선언 순서가 곧 조회 순서
 */
public enum Tier {

    SHORT_TERM("short-term cache"),
    LIVE_FETCH("live fetch"),
    LONG_TERM("long-term cache"),
    STATIC_FALLBACK("static fallback");

    private final String description;

    Tier(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
