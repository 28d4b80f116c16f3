package com.example.viticache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "api.auth")
public class ApiAuthProperties {

    private boolean enabled = true;

    /**
     * username -> password
     */
    private Map<String, String> users = new LinkedHashMap<>();
}
