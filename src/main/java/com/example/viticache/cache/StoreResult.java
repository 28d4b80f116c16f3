package com.example.viticache.cache;

import java.util.Optional;

/**
 * 휘발성 저장소 조회 결과
 * 연결 실패를 예외 대신 UNAVAILABLE 상태로 돌려준다
 */
public final class StoreResult<T> {

    public enum Status {
        HIT,
        MISS,
        UNAVAILABLE
    }

    private final Status status;
    private final T value;
    private final String reason;

    private StoreResult(Status status, T value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> StoreResult<T> hit(T value) {
        return new StoreResult<>(Status.HIT, value, null);
    }

    public static <T> StoreResult<T> miss() {
        return new StoreResult<>(Status.MISS, null, null);
    }

    public static <T> StoreResult<T> unavailable(String reason) {
        return new StoreResult<>(Status.UNAVAILABLE, null, reason);
    }

    public Status status() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public boolean isUnavailable() {
        return status == Status.UNAVAILABLE;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return reason == null ? status.name() : status + "(" + reason + ")";
    }
}
