package com.example.viticache.source;

import lombok.Value;

/**
 * 원천 조회 실패 (원천은 원래 불안정하므로 정상적인 결과의 한 종류로 취급)
 */
@Value
public class FetchError {

    public enum Type {
        NETWORK,
        HTTP_STATUS,
        PARSE,
        TIMEOUT,
        CANCELLED,
        UNEXPECTED
    }

    Type type;
    String message;

    public static FetchError of(Type type, String message) {
        return new FetchError(type, message);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
