package com.example.viticache.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Map;
import java.util.Set;

/**
 * HTTP Basic 인증 필터
 * 공개 경로(/heartbeat 등)를 제외한 모든 요청에 사용자/비밀번호를 요구한다
 */
@Slf4j
public class BasicAuthFilter extends OncePerRequestFilter {

    private static final String BASIC_PREFIX = "Basic ";
    private static final String REALM_HEADER = "Basic realm=\"viti-cache\"";

    private final Map<String, String> users;
    private final Set<String> publicPaths;

    public BasicAuthFilter(Map<String, String> users, Set<String> publicPaths) {
        this.users = Map.copyOf(users);
        this.publicPaths = Set.copyOf(publicPaths);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return publicPaths.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BASIC_PREFIX)) {
            reject(response, request.getRequestURI(), "missing credentials");
            return;
        }

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            reject(response, request.getRequestURI(), "malformed credentials");
            return;
        }

        int separator = decoded.indexOf(':');
        if (separator < 0 || !matches(decoded.substring(0, separator), decoded.substring(separator + 1))) {
            reject(response, request.getRequestURI(), "invalid credentials");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean matches(String username, String password) {
        String expected = users.get(username);
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), password.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response, String uri, String reason) throws IOException {
        log.debug("[인증 실패] uri={}, reason={}", uri, reason);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, REALM_HEADER);
        response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized access");
    }
}
