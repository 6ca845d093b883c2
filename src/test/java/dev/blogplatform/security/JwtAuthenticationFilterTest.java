package dev.blogplatform.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private JwtTokenProvider tokenProvider;

    private JwtAuthenticationFilter filter;

    private final AtomicReference<Authentication> seenAuthentication = new AtomicReference<>();

    private final WebFilterChain capturingChain = exchange -> ReactiveSecurityContextHolder.getContext()
            .map(SecurityContext::getAuthentication)
            .doOnNext(seenAuthentication::set)
            .then();

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(tokenProvider);
    }

    private static MockServerWebExchange exchangeWithAuthorization(String header) {
        MockServerHttpRequest.BaseBuilder<?> builder = MockServerHttpRequest.get("/api/v1/auth/me");
        if (header != null) {
            builder.header(HttpHeaders.AUTHORIZATION, header);
        }
        return MockServerWebExchange.from(builder.build());
    }

    @Test
    @DisplayName("Should authenticate a valid bearer token")
    void shouldAuthenticateValidToken() {
        Claims claims = Jwts.claims().subject("42").build();
        when(tokenProvider.validateAccessToken("good-token"))
                .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims));
        MockServerWebExchange exchange = exchangeWithAuthorization("Bearer good-token");

        StepVerifier.create(filter.filter(exchange, capturingChain)).verifyComplete();

        assertThat(seenAuthentication.get()).isNotNull();
        assertThat(seenAuthentication.get().getPrincipal()).isEqualTo(new AuthenticatedUser(42L));
        assertThat(seenAuthentication.get().getAuthorities()).extracting("authority").containsExactly("ROLE_USER");
        assertThat((Object) exchange.getAttribute(JwtAuthenticationFilter.AUTHENTICATED_USER_ATTR))
                .isEqualTo(new AuthenticatedUser(42L));
    }

    @Test
    @DisplayName("Should leave the request anonymous and record why when the token is rejected")
    void shouldStayAnonymousOnInvalidToken() {
        when(tokenProvider.validateAccessToken("bad-token"))
                .thenReturn(JwtTokenProvider.TokenValidationResult.invalid("Invalid token"));
        MockServerWebExchange exchange = exchangeWithAuthorization("Bearer bad-token");

        StepVerifier.create(filter.filter(exchange, capturingChain)).verifyComplete();

        assertThat(seenAuthentication.get()).isNull();
        assertThat((Object) exchange.getAttribute(JwtAuthenticationFilter.TOKEN_ERROR_ATTR)).isEqualTo("Invalid token");
    }

    @Test
    @DisplayName("Should skip validation without a bearer header")
    void shouldSkipWithoutHeader() {
        StepVerifier.create(filter.filter(exchangeWithAuthorization(null), capturingChain)).verifyComplete();
        StepVerifier.create(filter.filter(exchangeWithAuthorization("Basic dXNlcjpwYXNz"), capturingChain))
                .verifyComplete();

        assertThat(seenAuthentication.get()).isNull();
        verify(tokenProvider, never()).validateAccessToken(org.mockito.ArgumentMatchers.anyString());
    }
}
