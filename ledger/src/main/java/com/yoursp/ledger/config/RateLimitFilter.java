package com.yoursp.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Sliding window rate limiter using Redis ZADD + ZREMRANGEBYSCORE.
 * <p>
 * Guards the endpoints where guessing pays off: reset-token verification,
 * password reset, password login and biometric login. Fails open when Redis is
 * unreachable. Clients are keyed by remote address; {@code X-Forwarded-For} is
 * honoured only with {@code rate-limit.trust-forwarded-for=true}, i.e. behind a
 * proxy that overwrites it.
 * </p>
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    @Value("${rate-limit.trust-forwarded-for:false}")
    private boolean trustForwardedFor;

    public RateLimitFilter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        if (!enabled) {
            chain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        RateLimitConfig config = resolveConfig(request.getMethod(), path);

        if (config == null) {
            chain.doFilter(request, response);
            return;
        }

        String key = "ratelimit:" + config.endpointKey + ":" + resolveIdentifier(request);

        if (isRateLimited(key, config.maxRequests, config.windowSeconds)) {
            log.warn("Rate limited: key={}, path={}", key, path);
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(config.windowSeconds));
            response.setContentType("application/json");
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "error", "RATE_LIMITED",
                    "message", "Too many requests. Try again later.",
                    "retryAfterSeconds", config.windowSeconds)));
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean isRateLimited(String key, int maxRequests, int windowSeconds) {
        try {
            double now = Instant.now().toEpochMilli();
            double windowStart = now - (windowSeconds * 1000.0);

            // Remove expired entries
            redisTemplate.opsForZSet().removeRangeByScore(key, 0, windowStart);

            Long count = redisTemplate.opsForZSet().zCard(key);

            if (count != null && count >= maxRequests) {
                return true;
            }

            redisTemplate.opsForZSet().add(key, String.valueOf(now), now);
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds + 10));

            return false;
        } catch (Exception e) {
            // On Redis failure, allow the request (fail-open)
            log.warn("Rate limit check failed (allowing request): {}", e.getMessage());
            return false;
        }
    }

    RateLimitConfig resolveConfig(String method, String path) {
        if (!"POST".equalsIgnoreCase(method)) {
            return null;
        }
        if (path.endsWith("/reset-token/verify")) {
            return new RateLimitConfig("reset_verify", 10, 300);
        } else if (path.endsWith("/reset-token")) {
            return new RateLimitConfig("reset_issue", 5, 300);
        } else if (path.startsWith("/api/credentials/") && path.endsWith("/password")) {
            return new RateLimitConfig("reset_password", 5, 300);
        } else if (path.startsWith("/api/credentials/") && path.endsWith("/login")) {
            return new RateLimitConfig("password_login", 5, 300);
        } else if (path.equals("/api/biometrics/authenticate")) {
            return new RateLimitConfig("biometric_auth", 10, 60);
        }
        return null;
    }

    String resolveIdentifier(HttpServletRequest request) {
        if (trustForwardedFor) {
            String xff = request.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                return xff.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }

    record RateLimitConfig(String endpointKey, int maxRequests, int windowSeconds) {
    }
}
