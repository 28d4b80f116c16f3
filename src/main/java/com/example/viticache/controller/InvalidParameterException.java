package com.example.viticache.controller;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 잘못된 요청 파라미터 (400)
 */
public class InvalidParameterException extends RuntimeException {

    private final String endpoint;
    private final Map<String, String> providedParams;

    public InvalidParameterException(String endpoint, String message, Map<String, String> providedParams) {
        super(message);
        this.endpoint = endpoint;
        this.providedParams = Collections.unmodifiableMap(new LinkedHashMap<>(providedParams));
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Map<String, String> getProvidedParams() {
        return providedParams;
    }
}
