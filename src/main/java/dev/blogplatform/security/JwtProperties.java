package dev.blogplatform.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Token signing settings, read once at startup and immutable afterwards.
 * Startup fails when the secret is too short for the configured HMAC algorithm.
 */
@Component
@Getter
@Slf4j
public class JwtProperties {

    private final String secret;
    private final MacAlgorithm algorithm;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration resetTokenTtl;

    public JwtProperties(
            @Value("${app.security.jwt.secret}") String secret,
            @Value("${app.security.jwt.algorithm:HS256}") String algorithm,
            @Value("${app.security.jwt.issuer:blog-platform}") String issuer,
            @Value("${app.security.jwt.access-token-ttl:30m}") Duration accessTokenTtl,
            @Value("${app.security.jwt.reset-token-ttl:24h}") Duration resetTokenTtl
    ) {
        this.algorithm = resolveAlgorithm(algorithm);
        int minSecretLength = this.algorithm.getKeyBitLength() / Byte.SIZE;
        int actualLength = secret == null ? 0 : secret.getBytes(StandardCharsets.UTF_8).length;
        if (actualLength < minSecretLength) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d bytes for %s. Current length: %d. " +
                            "Please configure a secure app.security.jwt.secret property.",
                    minSecretLength, this.algorithm.getId(), actualLength));
        }
        this.secret = secret;
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.resetTokenTtl = resetTokenTtl;
        log.info("JWT settings loaded: algorithm={}, accessTtl={}, resetTtl={}",
                this.algorithm.getId(), accessTokenTtl, resetTokenTtl);
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        String normalized = name == null ? "HS256" : name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalStateException("Unsupported JWT algorithm: " + name);
        };
    }

    /** JCA name matching the algorithm, e.g. {@code HmacSHA256} for HS256. */
    public String getJcaKeyAlgorithm() {
        return "HmacSHA" + algorithm.getId().substring(2);
    }
}
