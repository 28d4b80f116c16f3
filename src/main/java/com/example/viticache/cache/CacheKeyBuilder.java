package com.example.viticache.cache;

import com.example.viticache.domain.Endpoint;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * (엔드포인트, 파라미터) -> CacheKey
 * - 엔드포인트별 허용 파라미터만 반영, 나머지는 무시
 * - 파라미터 이름은 소문자/trim, 값은 trim (값의 대소문자는 의미가 있으므로 유지)
 * - 사전순 정렬 후 길이 prefix 방식으로 직렬화해서 SHA-256
 */
@Component
public class CacheKeyBuilder {

    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    });

    public CacheKey build(Endpoint endpoint, Map<String, String> params) {
        Map<String, String> canonical = canonicalize(endpoint, params);

        StringBuilder sb = new StringBuilder(endpoint.path());
        for (Map.Entry<String, String> entry : canonical.entrySet()) {
            // "길이:값" 형태로 구분자 충돌을 막는다
            sb.append('|')
                    .append(entry.getKey().length()).append(':').append(entry.getKey())
                    .append('=')
                    .append(entry.getValue().length()).append(':').append(entry.getValue());
        }
        return new CacheKey(endpoint.path() + ":" + sha256Hex(sb.toString()));
    }

    /**
     * 키 계산에 쓰이는 정규화된 파라미터 (이름 소문자/trim, 허용 목록만, 사전순)
     */
    public Map<String, String> canonicalize(Endpoint endpoint, Map<String, String> params) {
        Map<String, String> canonical = new TreeMap<>();
        if (params == null) {
            return canonical;
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
            String value = entry.getValue().trim();
            if (value.isEmpty() || !endpoint.keyParameters().contains(name)) {
                continue;
            }
            canonical.put(name, value);
        }
        return canonical;
    }

    private String sha256Hex(String value) {
        MessageDigest md = SHA256.get();
        md.reset();
        byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
