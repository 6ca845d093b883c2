package dev.blogplatform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitingFilter")
class RateLimitingFilterTest {

    private static final String TEST_IP = "203.0.113.7";

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    private RateLimitingFilter filter;
    private final AtomicInteger passedThrough = new AtomicInteger();
    private final WebFilterChain chain = exchange -> {
        passedThrough.incrementAndGet();
        return Mono.empty();
    };

    @BeforeEach
    void setUp() {
        RateLimitProperties properties = new RateLimitProperties(true, 3, 2, 60);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        filter = new RateLimitingFilter(redisTemplate, properties, new ResilienceConfig(10, 2, 30), objectMapper);
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private static MockServerWebExchange exchange(MockServerHttpRequest.BaseBuilder<?> builder) {
        return MockServerWebExchange.from(builder.remoteAddress(new InetSocketAddress(TEST_IP, 0)));
    }

    @Nested
    @DisplayName("with Redis available")
    class WithRedis {

        @Test
        @DisplayName("First request should create the counter with its window TTL and report the remaining budget")
        void firstRequestCreatesCounterWithTtl() {
            String key = RateLimitingFilter.KEY_PREFIX + TEST_IP;
            when(valueOperations.setIfAbsent(key, "0", Duration.ofSeconds(60))).thenReturn(Mono.just(true));
            when(valueOperations.increment(key)).thenReturn(Mono.just(1L));
            MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/posts"));

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertThat(passedThrough.get()).isEqualTo(1);
            HttpHeaders headers = exchange.getResponse().getHeaders();
            assertThat(headers.getFirst("X-RateLimit-Limit")).isEqualTo("3");
            assertThat(headers.getFirst("X-RateLimit-Remaining")).isEqualTo("2");
            verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("A counter recreated without TTL between the two calls should get its window back")
        void bareCounterGetsWindowRestored() {
            String key = RateLimitingFilter.KEY_PREFIX + TEST_IP;
            when(valueOperations.setIfAbsent(key, "0", Duration.ofSeconds(60))).thenReturn(Mono.just(false));
            when(valueOperations.increment(key)).thenReturn(Mono.just(1L));
            when(redisTemplate.expire(key, Duration.ofSeconds(60))).thenReturn(Mono.just(true));

            StepVerifier.create(filter.filter(exchange(MockServerHttpRequest.get("/api/v1/posts")), chain))
                    .verifyComplete();

            assertThat(passedThrough.get()).isEqualTo(1);
            verify(redisTemplate).expire(key, Duration.ofSeconds(60));
        }

        @Test
        @DisplayName("Request over the budget should be answered with 429")
        void overBudgetIsRejected() {
            when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(false));
            when(valueOperations.increment(RateLimitingFilter.KEY_PREFIX + TEST_IP)).thenReturn(Mono.just(4L));
            MockServerWebExchange exchange = exchange(MockServerHttpRequest.get("/api/v1/posts"));

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertThat(passedThrough.get()).isZero();
            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
            assertThat(exchange.getResponse().getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("60");
            assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
            StepVerifier.create(exchange.getResponse().getBodyAsString())
                    .assertNext(body -> assertThat(body).contains("Rate limit exceeded").contains("\"status\":429"))
                    .verifyComplete();
            verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Auth endpoints should use their own, tighter budget")
        void authPathsUseSeparateBudget() {
            when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(false));
            when(valueOperations.increment(RateLimitingFilter.KEY_PREFIX + "auth:" + TEST_IP)).thenReturn(Mono.just(3L));
            MockServerWebExchange exchange = exchange(MockServerHttpRequest.post("/api/v1/auth/signin"));

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
            assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit")).isEqualTo("2");
        }
    }

    @Test
    @DisplayName("Should fall back to in-memory counting when Redis fails")
    void fallsBackToMemory() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenReturn(Mono.error(new IllegalStateException("redis down")));

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(filter.filter(exchange(MockServerHttpRequest.get("/api/v1/tags")), chain))
                    .verifyComplete();
        }
        MockServerWebExchange fourth = exchange(MockServerHttpRequest.get("/api/v1/tags"));
        StepVerifier.create(filter.filter(fourth, chain)).verifyComplete();

        assertThat(passedThrough.get()).isEqualTo(3);
        assertThat(fourth.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    @DisplayName("In-memory counters should be kept per key")
    void inMemoryCountersArePerKey() {
        assertThat(filter.incrementInMemory("rate_limit:a")).isEqualTo(1);
        assertThat(filter.incrementInMemory("rate_limit:a")).isEqualTo(2);
        assertThat(filter.incrementInMemory("rate_limit:b")).isEqualTo(1);
    }

    @Test
    @DisplayName("Health checks should bypass rate limiting")
    void healthIsExempt() {
        StepVerifier.create(filter.filter(exchange(MockServerHttpRequest.get("/health")), chain)).verifyComplete();
        StepVerifier.create(filter.filter(exchange(MockServerHttpRequest.get("/actuator/health")), chain)).verifyComplete();

        assertThat(passedThrough.get()).isEqualTo(2);
        verifyNoInteractions(valueOperations);
    }

    @Test
    @DisplayName("Disabled limiter should pass everything through")
    void disabledLimiter() {
        RateLimitingFilter disabled = new RateLimitingFilter(redisTemplate, new RateLimitProperties(false, 1, 1, 60),
                new ResilienceConfig(10, 2, 30), new ObjectMapper());

        StepVerifier.create(disabled.filter(exchange(MockServerHttpRequest.get("/api/v1/posts")), chain)).verifyComplete();

        assertThat(passedThrough.get()).isEqualTo(1);
        verifyNoInteractions(valueOperations);
    }
}
