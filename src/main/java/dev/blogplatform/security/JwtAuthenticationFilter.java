package dev.blogplatform.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <access token>}.
 * <p>
 * A missing or rejected token leaves the request anonymous; the security chain
 * then answers 401 on protected routes while public reads still work. The
 * rejection reason is kept as an exchange attribute for the 401 body.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    public static final String AUTHENTICATED_USER_ATTR = "authenticatedUser";
    public static final String TOKEN_ERROR_ATTR = "tokenError";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES =
            List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final JwtTokenProvider tokenProvider;

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith(BEARER_PREFIX)) {
            return bearerToken.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        var validation = tokenProvider.validateAccessToken(jwt);
        if (!validation.valid()) {
            log.warn("Rejected bearer token ({}) for path: {}", validation.error(),
                    exchange.getRequest().getPath().value());
            exchange.getAttributes().put(TOKEN_ERROR_ATTR, validation.error());
            return chain.filter(exchange);
        }

        var principal = new AuthenticatedUser(validation.userId());
        exchange.getAttributes().put(AUTHENTICATED_USER_ATTR, principal);
        var auth = new UsernamePasswordAuthenticationToken(principal, null, USER_AUTHORITIES);
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }
}
