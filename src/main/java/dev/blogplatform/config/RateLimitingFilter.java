package dev.blogplatform.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.blogplatform.exception.ErrorResponse;
import dev.blogplatform.util.IpAddressExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window request budget per client address. Counters live in Redis; when
 * Redis is unreachable a local Caffeine cache takes over for the same window.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@Slf4j
public class RateLimitingFilter implements WebFilter {

    static final String KEY_PREFIX = "rate_limit:";

    private static final Set<String> AUTH_PATHS = Set.of(
            "/api/v1/auth/signin",
            "/api/v1/auth/forgot-password",
            "/api/v1/auth/reset-password"
    );

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RateLimitProperties properties;
    private final ResilienceConfig resilience;
    private final ObjectMapper objectMapper;
    private final Cache<String, AtomicLong> inMemoryCounters;

    public RateLimitingFilter(ReactiveStringRedisTemplate redisTemplate,
                              RateLimitProperties properties,
                              ResilienceConfig resilience,
                              ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.resilience = resilience;
        this.objectMapper = objectMapper;
        this.inMemoryCounters = Caffeine.newBuilder()
                .expireAfterWrite(properties.getWindow())
                .maximumSize(100_000)
                .build();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!properties.isEnabled() || isExempt(path)) {
            return chain.filter(exchange);
        }

        String clientIp = IpAddressExtractor.extractClientIp(exchange);
        boolean authPath = AUTH_PATHS.contains(path);
        int maxRequests = authPath ? properties.getAuthRequests() : properties.getRequests();
        String key = KEY_PREFIX + (authPath ? "auth:" : "") + clientIp;

        return incrementInRedis(key)
                .onErrorResume(e -> {
                    log.warn("Rate limiting Redis unavailable ({}), using in-memory fallback: {}",
                            e.getClass().getSimpleName(), e.getMessage());
                    return Mono.just(incrementInMemory(key));
                })
                .flatMap(count -> {
                    HttpHeaders headers = exchange.getResponse().getHeaders();
                    headers.set("X-RateLimit-Limit", String.valueOf(maxRequests));
                    if (count > maxRequests) {
                        log.warn("Rate limit exceeded for IP: {}, path: {}, count: {}", clientIp, path, count);
                        headers.set("X-RateLimit-Remaining", "0");
                        headers.set("X-RateLimit-Reset",
                                String.valueOf(Instant.now().plus(properties.getWindow()).getEpochSecond()));
                        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(properties.getWindow().toSeconds()));
                        return reject(exchange, path);
                    }
                    headers.set("X-RateLimit-Remaining", String.valueOf(Math.max(0, maxRequests - count)));
                    return chain.filter(exchange);
                });
    }

    private static boolean isExempt(String path) {
        return path.equals("/health") || path.startsWith("/actuator/health");
    }

    /**
     * Creates the counter with its TTL in one {@code SET NX EX}, then increments it,
     * so a counter never exists without an expiry. An INCR that lands right after the
     * key expired recreates it bare; that case is detected and the TTL re-applied.
     */
    private Mono<Long> incrementInRedis(String key) {
        ReactiveValueOperations<String, String> ops = redisTemplate.opsForValue();
        return ops.setIfAbsent(key, "0", properties.getWindow())
                .flatMap(created -> ops.increment(key)
                        .flatMap(count -> {
                            if (!created && count == 1) {
                                log.debug("Rate limit key {} expired mid-request, restoring its window", key);
                                return redisTemplate.expire(key, properties.getWindow()).thenReturn(count);
                            }
                            return Mono.just(count);
                        }))
                .timeout(resilience.getRedisTimeout());
    }

    long incrementInMemory(String key) {
        return inMemoryCounters.get(key, k -> new AtomicLong()).incrementAndGet();
    }

    private Mono<Void> reject(ServerWebExchange exchange, String path) {
        exchange.getResponse().setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Too Many Requests")
                .message("Rate limit exceeded")
                .path(path)
                .requestId(exchange.getAttribute(RequestIdFilter.REQUEST_ID_ATTR))
                .build();
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rate limit response", e);
            bytes = "{\"success\":false,\"status\":429,\"error\":\"Too Many Requests\",\"message\":\"Rate limit exceeded\"}"
                    .getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
