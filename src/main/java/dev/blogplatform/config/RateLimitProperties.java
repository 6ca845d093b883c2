package dev.blogplatform.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Getter
@Slf4j
public class RateLimitProperties {

    private final boolean enabled;
    private final int requests;
    private final int authRequests;
    private final Duration window;

    public RateLimitProperties(
            @Value("${app.rate-limit.enabled:true}") boolean enabled,
            @Value("${app.rate-limit.requests:100}") int requests,
            @Value("${app.rate-limit.auth-requests:10}") int authRequests,
            @Value("${app.rate-limit.window-seconds:60}") int windowSeconds) {
        if (requests < 1 || authRequests < 1 || windowSeconds < 1) {
            throw new IllegalStateException("Rate limit settings must be positive");
        }
        this.enabled = enabled;
        this.requests = requests;
        this.authRequests = authRequests;
        this.window = Duration.ofSeconds(windowSeconds);
        log.info("Rate limiting {}: {} requests ({} for auth) per {}s",
                enabled ? "enabled" : "disabled", requests, authRequests, windowSeconds);
    }
}
