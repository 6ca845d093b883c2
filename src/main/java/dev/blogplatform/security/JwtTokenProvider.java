package dev.blogplatform.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the two token kinds: short-lived access tokens and
 * password-reset tokens. Verification is pure: no I/O and no shared mutable state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtTokenProvider {

    public static final String CREDENTIALS_VERSION_CLAIM = "ver";

    private final JwtProperties properties;

    private Clock clock = Clock.systemUTC();
    private SecretKey key;
    private JwtParser jwtParser;

    /**
     * Replaces the time source; must be called before {@link #init()}.
     */
    void useClock(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        this.key = new SecretKeySpec(properties.getSecret().getBytes(StandardCharsets.UTF_8),
                properties.getJcaKeyAlgorithm());
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(properties.getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build();
        log.info("JWT token provider initialized with {} algorithm", properties.getAlgorithm().getId());
    }

    public String generateAccessToken(Long userId) {
        return issue(userId, TokenKind.ACCESS, properties.getAccessTokenTtl(), null);
    }

    /**
     * Reset tokens embed the user's credentials version so the first successful
     * reset (or any password change) invalidates every outstanding reset token.
     */
    public String generatePasswordResetToken(Long userId, int credentialsVersion) {
        return issue(userId, TokenKind.PASSWORD_RESET, properties.getResetTokenTtl(), credentialsVersion);
    }

    public long getAccessTokenTtlSeconds() {
        return properties.getAccessTokenTtl().toSeconds();
    }

    private String issue(Long userId, TokenKind kind, Duration ttl, Integer credentialsVersion) {
        var now = clock.instant();
        var builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(String.valueOf(userId))
                .claim(TokenKind.CLAIM, kind.claimValue())
                .issuer(properties.getIssuer())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)));
        if (credentialsVersion != null) {
            builder.claim(CREDENTIALS_VERSION_CLAIM, credentialsVersion);
        }
        log.debug("Issued {} token for user id={}", kind.claimValue(), userId);
        return builder.signWith(key, properties.getAlgorithm()).compact();
    }

    /**
     * Result of token validation. Expired and invalid are told apart for logging
     * only; callers map both to the same external response.
     */
    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }
        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }
        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }

        public Long userId() {
            if (claims == null || claims.getSubject() == null) {
                return null;
            }
            try {
                return Long.valueOf(claims.getSubject());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    public TokenValidationResult validateAccessToken(String token) {
        return validate(token, TokenKind.ACCESS);
    }

    public TokenValidationResult validatePasswordResetToken(String token) {
        return validate(token, TokenKind.PASSWORD_RESET);
    }

    /**
     * Checks signature, algorithm, issuer and expiry in a single parse, then the kind claim.
     */
    private TokenValidationResult validate(String token, TokenKind expectedKind) {
        try {
            Jws<Claims> jws = jwtParser.parseSignedClaims(token);
            String algorithm = jws.getHeader().getAlgorithm();
            if (!properties.getAlgorithm().getId().equals(algorithm)) {
                log.warn("JWT signed with unexpected algorithm: {}", algorithm);
                return TokenValidationResult.invalid("Unexpected signing algorithm");
            }
            Claims claims = jws.getPayload();
            // jjwt accepts a token at exactly its exp instant; expiry is exclusive here
            Date expiration = claims.getExpiration();
            if (expiration == null) {
                log.warn("JWT without expiry rejected");
                return TokenValidationResult.invalid("Missing expiry");
            }
            if (!clock.instant().isBefore(expiration.toInstant())) {
                log.warn("JWT token expired at {}", expiration.toInstant());
                return TokenValidationResult.expired("Token expired");
            }
            String kind = claims.get(TokenKind.CLAIM, String.class);
            if (!expectedKind.claimValue().equals(kind)) {
                log.warn("JWT kind mismatch: expected {}, got {}", expectedKind.claimValue(), kind);
                return TokenValidationResult.invalid("Wrong token kind");
            }
            var result = TokenValidationResult.success(claims);
            if (result.userId() == null) {
                log.warn("JWT subject is not a user id");
                return TokenValidationResult.invalid("Invalid subject");
            }
            return result;
        } catch (ExpiredJwtException e) {
            log.warn("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (MalformedJwtException e) {
            log.warn("JWT token malformed: {}", e.getMessage());
            return TokenValidationResult.invalid("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token uses unsupported features: {}", e.getMessage());
            return TokenValidationResult.invalid("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT validation failed, possible forgery or wrong secret: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty or null token");
        }
    }
}
