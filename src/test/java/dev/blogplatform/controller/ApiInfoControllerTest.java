package dev.blogplatform.controller;

import dev.blogplatform.config.ResilienceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiInfoControllerTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private DatabaseClient.GenericExecuteSpec executeSpec;

    @Mock
    private FetchSpec<Map<String, Object>> fetchSpec;

    private ApiInfoController controller;

    @BeforeEach
    void setUp() {
        controller = new ApiInfoController(databaseClient, new ResilienceConfig(1, 1, 1), "Blog Platform API", "1.2.3");
    }

    @Test
    @DisplayName("Root should describe the API")
    void rootInfo() {
        StepVerifier.create(controller.getApiInfo())
                .assertNext(info -> assertThat(info)
                        .containsEntry("name", "Blog Platform API")
                        .containsEntry("version", "1.2.3")
                        .containsEntry("api", "/api/v1"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Health should be healthy when the database answers")
    void healthy() {
        when(databaseClient.sql("SELECT 1")).thenReturn(executeSpec);
        when(executeSpec.fetch()).thenReturn(fetchSpec);
        when(fetchSpec.first()).thenReturn(Mono.just(Map.of("?column?", 1)));

        StepVerifier.create(controller.healthCheck())
                .assertNext(body -> assertThat(body)
                        .containsEntry("status", "healthy")
                        .containsEntry("database", "up"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Health should degrade, not fail, when the database is down")
    void degraded() {
        when(databaseClient.sql("SELECT 1")).thenReturn(executeSpec);
        when(executeSpec.fetch()).thenReturn(fetchSpec);
        when(fetchSpec.first()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(controller.healthCheck())
                .assertNext(body -> assertThat(body)
                        .containsEntry("status", "degraded")
                        .containsEntry("database", "down"))
                .verifyComplete();
    }
}
