package dev.blogplatform.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timeouts for calls leaving the process (database health check, Redis, SMTP).
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration redisTimeout;
    private final Duration mailTimeout;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.redis.timeout-seconds:2}") int redisTimeoutSeconds,
            @Value("${resilience.mail.timeout-seconds:30}") int mailTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.redisTimeout = Duration.ofSeconds(redisTimeoutSeconds);
        this.mailTimeout = Duration.ofSeconds(mailTimeoutSeconds);
        log.info("Resilience configuration initialized (db={}s, redis={}s, mail={}s)",
                databaseTimeoutSeconds, redisTimeoutSeconds, mailTimeoutSeconds);
    }
}
