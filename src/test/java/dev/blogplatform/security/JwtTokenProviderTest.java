package dev.blogplatform.security;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private static final String SECRET = "this-is-a-test-secret-key-that-is-long-enough-for-hs512-signing-ok";
    private static final String ISSUER = "blog-platform";

    private JwtTokenProvider tokenProvider;

    private static JwtProperties properties(String secret, String algorithm, Duration accessTtl) {
        return new JwtProperties(secret, algorithm, ISSUER, accessTtl, Duration.ofHours(24));
    }

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider(properties(SECRET, "HS256", Duration.ofMinutes(30)));
        tokenProvider.init();
    }

    @Nested
    @DisplayName("Access tokens")
    class AccessTokens {

        @Test
        @DisplayName("Should round-trip the user id")
        void shouldValidateFreshToken() {
            String token = tokenProvider.generateAccessToken(42L);

            var result = tokenProvider.validateAccessToken(token);

            assertThat(token.split("\\.")).hasSize(3);
            assertThat(result.valid()).isTrue();
            assertThat(result.userId()).isEqualTo(42L);
            assertThat(result.claims().get(TokenKind.CLAIM, String.class)).isEqualTo("access");
            assertThat(result.claims().getIssuer()).isEqualTo(ISSUER);
        }

        @Test
        @DisplayName("Should report the configured lifetime in seconds")
        void shouldExposeTtlSeconds() {
            assertThat(tokenProvider.getAccessTokenTtlSeconds()).isEqualTo(1800L);
        }

        @Test
        @DisplayName("Should reject an expired token")
        void shouldRejectExpiredToken() {
            SecretKey key = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            String expired = Jwts.builder()
                    .subject("42")
                    .claim(TokenKind.CLAIM, "access")
                    .issuer(ISSUER)
                    .issuedAt(new Date(System.currentTimeMillis() - 120_000))
                    .expiration(new Date(System.currentTimeMillis() - 60_000))
                    .signWith(key, Jwts.SIG.HS256)
                    .compact();

            var result = tokenProvider.validateAccessToken(expired);

            assertThat(result.valid()).isFalse();
            assertThat(result.expired()).isTrue();
        }

        @Test
        @DisplayName("Should treat the expiry instant itself as expired")
        void shouldRejectAtExactExpiry() {
            Instant issuedAt = Instant.parse("2026-01-01T00:00:00Z");
            Instant expiresAt = issuedAt.plus(Duration.ofMinutes(30));
            String token = providerAt(issuedAt).generateAccessToken(42L);

            var justBefore = providerAt(expiresAt.minusMillis(1)).validateAccessToken(token);
            var atExpiry = providerAt(expiresAt).validateAccessToken(token);

            assertThat(justBefore.valid()).isTrue();
            assertThat(atExpiry.valid()).isFalse();
            assertThat(atExpiry.expired()).isTrue();
        }

        private JwtTokenProvider providerAt(Instant now) {
            var provider = new JwtTokenProvider(properties(SECRET, "HS256", Duration.ofMinutes(30)));
            provider.useClock(Clock.fixed(now, ZoneOffset.UTC));
            provider.init();
            return provider;
        }

        @Test
        @DisplayName("Should reject a token signed with another secret")
        void shouldRejectForeignSignature() {
            var other = new JwtTokenProvider(properties(
                    "another-secret-key-that-is-also-long-enough-for-hmac", "HS256", Duration.ofMinutes(30)));
            other.init();

            var result = tokenProvider.validateAccessToken(other.generateAccessToken(42L));

            assertThat(result.valid()).isFalse();
            assertThat(result.expired()).isFalse();
        }

        @Test
        @DisplayName("Should reject a token with a different issuer")
        void shouldRejectForeignIssuer() {
            SecretKey key = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            String token = Jwts.builder()
                    .subject("42")
                    .claim(TokenKind.CLAIM, "access")
                    .issuer("someone-else")
                    .expiration(new Date(System.currentTimeMillis() + 60_000))
                    .signWith(key, Jwts.SIG.HS256)
                    .compact();

            assertThat(tokenProvider.validateAccessToken(token).valid()).isFalse();
        }

        @Test
        @DisplayName("Should reject a token signed with a different HMAC algorithm")
        void shouldRejectAlgorithmMismatch() {
            var hs512 = new JwtTokenProvider(properties(SECRET, "HS512", Duration.ofMinutes(30)));
            hs512.init();

            assertThat(tokenProvider.validateAccessToken(hs512.generateAccessToken(42L)).valid()).isFalse();
        }

        @Test
        @DisplayName("Should reject garbage, empty and null input")
        void shouldRejectMalformedInput() {
            assertThat(tokenProvider.validateAccessToken("not.a.jwt").valid()).isFalse();
            assertThat(tokenProvider.validateAccessToken("").valid()).isFalse();
            assertThat(tokenProvider.validateAccessToken(null).valid()).isFalse();
        }

        @Test
        @DisplayName("Should reject a token whose subject is not a user id")
        void shouldRejectNonNumericSubject() {
            SecretKey key = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            String token = Jwts.builder()
                    .subject("alice@example.com")
                    .claim(TokenKind.CLAIM, "access")
                    .issuer(ISSUER)
                    .expiration(new Date(System.currentTimeMillis() + 60_000))
                    .signWith(key, Jwts.SIG.HS256)
                    .compact();

            assertThat(tokenProvider.validateAccessToken(token).valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Token kinds")
    class TokenKinds {

        @Test
        @DisplayName("Reset token should carry kind and credentials version")
        void resetTokenShouldCarryVersion() {
            String token = tokenProvider.generatePasswordResetToken(7L, 3);

            var result = tokenProvider.validatePasswordResetToken(token);

            assertThat(result.valid()).isTrue();
            assertThat(result.userId()).isEqualTo(7L);
            assertThat(result.claims().get(JwtTokenProvider.CREDENTIALS_VERSION_CLAIM, Integer.class)).isEqualTo(3);
        }

        @Test
        @DisplayName("Reset token should not pass as an access token")
        void resetTokenRejectedOnAccessPath() {
            String token = tokenProvider.generatePasswordResetToken(7L, 0);

            assertThat(tokenProvider.validateAccessToken(token).valid()).isFalse();
        }

        @Test
        @DisplayName("Access token should not pass as a reset token")
        void accessTokenRejectedOnResetPath() {
            String token = tokenProvider.generateAccessToken(7L);

            assertThat(tokenProvider.validatePasswordResetToken(token).valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Should refuse a secret shorter than the algorithm requires")
        void shouldRejectShortSecret() {
            assertThatThrownBy(() -> properties("too-short", "HS256", Duration.ofMinutes(30)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("at least 32 bytes");
        }

        @Test
        @DisplayName("HS512 should need a 64-byte secret")
        void hs512NeedsLongerSecret() {
            String secret32 = "0123456789abcdef0123456789abcdef";

            assertThatThrownBy(() -> properties(secret32, "HS512", Duration.ofMinutes(30)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("64 bytes");
        }

        @Test
        @DisplayName("Should refuse unknown algorithms")
        void shouldRejectUnknownAlgorithm() {
            assertThatThrownBy(() -> properties(SECRET, "RS256", Duration.ofMinutes(30)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Unsupported JWT algorithm");
        }

        @Test
        @DisplayName("Should map the algorithm to its JCA key name")
        void shouldExposeJcaName() {
            assertThat(properties(SECRET, "hs384", Duration.ofMinutes(30)).getJcaKeyAlgorithm())
                    .isEqualTo("HmacSHA384");
        }
    }
}
