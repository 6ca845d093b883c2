package dev.blogplatform.controller;

import dev.blogplatform.config.ResilienceConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API information and health endpoints.
 */
@RestController
@Tag(name = "API Info", description = "API information and health")
@Slf4j
public class ApiInfoController {

    private final DatabaseClient databaseClient;
    private final ResilienceConfig resilience;
    private final String appName;
    private final String appVersion;

    public ApiInfoController(DatabaseClient databaseClient,
                             ResilienceConfig resilience,
                             @Value("${app.name:Blog Platform API}") String appName,
                             @Value("${app.version:1.0.0}") String appVersion) {
        this.databaseClient = databaseClient;
        this.resilience = resilience;
        this.appName = appName;
        this.appVersion = appVersion;
    }

    @GetMapping("/")
    @Operation(summary = "API Root", description = "Service name, version and entry points")
    public Mono<Map<String, Object>> getApiInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("api", "/api/v1");
        info.put("documentation", "/swagger-ui.html");
        info.put("health", "/health");
        return Mono.just(info);
    }

    /**
     * Answers 200 either way; the body reports {@code degraded} when the database does not respond.
     */
    @GetMapping("/health")
    @Operation(summary = "Health Check", description = "Liveness plus a database round trip")
    public Mono<Map<String, Object>> healthCheck() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(resilience.getDatabaseTimeout())
                .map(row -> "up")
                .defaultIfEmpty("down")
                .onErrorResume(e -> {
                    log.warn("Health check database query failed: {}", e.getMessage());
                    return Mono.just("down");
                })
                .map(database -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "up".equals(database) ? "healthy" : "degraded");
                    body.put("database", database);
                    body.put("version", appVersion);
                    body.put("timestamp", LocalDateTime.now().toString());
                    return body;
                });
    }
}
