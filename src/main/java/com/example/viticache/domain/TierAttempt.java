package com.example.viticache.domain;

import lombok.Value;

/**
 * 한 계층을 시도한 결과 (진단용)
 */
@Value
public class TierAttempt {

    public enum Outcome {
        HIT,
        MISS,
        UNAVAILABLE,
        FAILED
    }

    Tier tier;
    Outcome outcome;
    String detail;

    public static TierAttempt hit(Tier tier) {
        return new TierAttempt(tier, Outcome.HIT, null);
    }

    public static TierAttempt miss(Tier tier, String detail) {
        return new TierAttempt(tier, Outcome.MISS, detail);
    }

    public static TierAttempt unavailable(Tier tier, String detail) {
        return new TierAttempt(tier, Outcome.UNAVAILABLE, detail);
    }

    public static TierAttempt failed(Tier tier, String detail) {
        return new TierAttempt(tier, Outcome.FAILED, detail);
    }
}
