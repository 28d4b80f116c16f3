package com.example.viticache.auth;

import com.example.viticache.config.ApiAuthProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
public class AuthConfig {

    /**
     * 인증 없이 열어 두는 경로
     */
    static final Set<String> PUBLIC_PATHS = Set.of("/heartbeat", "/error");

    @Bean
    @ConditionalOnProperty(name = "api.auth.enabled", havingValue = "true", matchIfMissing = true)
    public BasicAuthFilter basicAuthFilter(ApiAuthProperties properties) {
        return new BasicAuthFilter(properties.getUsers(), PUBLIC_PATHS);
    }
}
