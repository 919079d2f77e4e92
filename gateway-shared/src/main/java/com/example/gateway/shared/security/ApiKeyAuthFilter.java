package com.example.gateway.shared.security;

import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.dto.ErrorResponse;
import com.example.gateway.shared.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Checks a bearer token or API-key header against the configured allow-list.
 * With no tokens configured every protected route is rejected with 403 unless
 * {@code gateway.auth.disabled=true} is set explicitly.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class ApiKeyAuthFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<String> PUBLIC_PATH_PREFIXES = List.of("/actuator/health");

    private final List<byte[]> acceptedTokens;
    private final boolean disabled;
    private final String apiKeyHeader;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthFilter(AppProperties appProperties, ObjectMapper objectMapper) {
        AppProperties.Auth auth = appProperties.getAuth();
        this.acceptedTokens = auth.getTokens().stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.trim().getBytes(StandardCharsets.UTF_8))
                .toList();
        this.disabled = auth.isDisabled();
        this.apiKeyHeader = auth.getApiKeyHeader();
        this.objectMapper = objectMapper;

        if (disabled) {
            log.warn("API authentication is DISABLED (gateway.auth.disabled=true). Do not run like this outside local development.");
        } else if (acceptedTokens.isEmpty()) {
            log.error("No API tokens configured (gateway.auth.tokens). All protected routes will answer 403.");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (disabled || isPublic(path)) {
            return chain.filter(exchange);
        }

        if (acceptedTokens.isEmpty()) {
            return reject(exchange, ErrorCode.AUTH_NOT_CONFIGURED, "API authentication is not configured");
        }

        String provided = extractToken(exchange);
        if (provided == null || !isAccepted(provided)) {
            log.warn("Rejected request with missing or unknown API token: {} {}",
                    exchange.getRequest().getMethod(), path);
            return reject(exchange, ErrorCode.UNAUTHORIZED, "Missing or invalid API token");
        }
        return chain.filter(exchange);
    }

    private boolean isPublic(String path) {
        return PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private String extractToken(ServerWebExchange exchange) {
        HttpHeaders headers = exchange.getRequest().getHeaders();
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        String apiKey = headers.getFirst(apiKeyHeader);
        return apiKey == null ? null : apiKey.trim();
    }

    private boolean isAccepted(String provided) {
        byte[] candidate = provided.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] token : acceptedTokens) {
            // constant time over every configured token
            match |= MessageDigest.isEqual(token, candidate);
        }
        return match;
    }

    private Mono<Void> reject(ServerWebExchange exchange, ErrorCode code, String message) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(code.status());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ErrorResponse body = new ErrorResponse(
                OffsetDateTime.now(),
                code.status().value(),
                code.code(),
                message,
                exchange.getRequest().getPath().toString());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize auth error body: {}", e.getMessage());
            bytes = ("{\"error\":\"" + code.code() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }
}
