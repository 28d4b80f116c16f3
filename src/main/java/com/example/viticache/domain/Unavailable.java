package com.example.viticache.domain;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 모든 계층이 실패했을 때의 결과
 * 어떤 계층을 어떤 이유로 놓쳤는지 담아서 호출자가 503 응답을 구성할 수 있게 한다
 */
@Value
public class Unavailable {

    Endpoint endpoint;
    Map<String, String> requestedParams;
    List<TierAttempt> attempts;

    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (TierAttempt attempt : attempts) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(attempt.getTier().description()).append('=').append(attempt.getOutcome());
            if (attempt.getDetail() != null) {
                sb.append(" (").append(attempt.getDetail()).append(')');
            }
        }
        return sb.toString();
    }
}
