package com.example.viticache.source;

/**
 * 요청 하나에 대한 원천 조회 동작
 * 구현체가 예외를 던지더라도 Coordinator가 FetchError로 변환한다
 */
@FunctionalInterface
public interface LiveFetch {

    FetchResult fetch();
}
