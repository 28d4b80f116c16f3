package com.example.viticache.domain;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Coordinator의 해석 결과: 성공(CacheEntry) 또는 전체 소진(Unavailable)
 * 예외를 던지지 않고 두 경우를 타입으로 구분한다
 */
public final class Resolution {

    private final CacheEntry entry;
    private final Unavailable unavailable;
    private final List<TierAttempt> attempts;

    private Resolution(CacheEntry entry, Unavailable unavailable, List<TierAttempt> attempts) {
        this.entry = entry;
        this.unavailable = unavailable;
        this.attempts = List.copyOf(attempts);
    }

    public static Resolution resolved(CacheEntry entry, List<TierAttempt> attempts) {
        return new Resolution(Objects.requireNonNull(entry, "entry"), null, attempts);
    }

    public static Resolution unavailable(Unavailable unavailable) {
        Objects.requireNonNull(unavailable, "unavailable");
        return new Resolution(null, unavailable, unavailable.getAttempts());
    }

    public boolean isResolved() {
        return entry != null;
    }

    public CacheEntry entry() {
        if (entry == null) {
            throw new IllegalStateException("Resolution is unavailable: " + unavailable.summary());
        }
        return entry;
    }

    public Unavailable unavailable() {
        if (unavailable == null) {
            throw new IllegalStateException("Resolution is resolved");
        }
        return unavailable;
    }

    public List<TierAttempt> attempts() {
        return attempts;
    }

    public <R> R fold(Function<CacheEntry, R> onResolved, Function<Unavailable, R> onUnavailable) {
        return isResolved() ? onResolved.apply(entry) : onUnavailable.apply(unavailable);
    }
}
