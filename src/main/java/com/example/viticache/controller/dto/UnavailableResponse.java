package com.example.viticache.controller.dto;

import com.example.viticache.domain.TierAttempt;
import com.example.viticache.domain.Unavailable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 모든 계층이 실패했을 때의 503 응답
 */
@Value
@Builder
public class UnavailableResponse {

    String error;
    String message;
    String endpoint;
    String status;
    Map<String, String> requestedParams;
    @Singular
    List<Attempt> attempts;
    Map<String, String> troubleshooting;
    Map<String, Object> systemStatus;
    String timestamp;

    public static UnavailableResponse of(Unavailable unavailable, Map<String, Object> systemStatus, String timestamp) {
        UnavailableResponseBuilder builder = UnavailableResponse.builder()
                .error("Data temporarily unavailable")
                .message("All data sources (web scraping, cache, and local files) are currently unavailable. "
                        + "Please try again later.")
                .endpoint(unavailable.getEndpoint().path())
                .status("data_unavailable")
                .requestedParams(unavailable.getRequestedParams())
                .troubleshooting(Map.of(
                        "retry_suggestion", "Try again in a few minutes",
                        "alternative_years", "Try different year parameters",
                        "contact_support", "If the issue persists, contact support"))
                .systemStatus(systemStatus)
                .timestamp(timestamp);
        for (TierAttempt attempt : unavailable.getAttempts()) {
            builder.attempt(new Attempt(
                    attempt.getTier().description(), attempt.getOutcome().name().toLowerCase(), attempt.getDetail()));
        }
        return builder.build();
    }

    @Value
    public static class Attempt {
        String tier;
        String outcome;
        String detail;
    }
}
