package dev.blogplatform.service;

import dev.blogplatform.entity.User;
import dev.blogplatform.exception.InvalidTokenException;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.JwtTokenProvider;
import dev.blogplatform.security.PasswordHasher;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Forgot-password and reset-password flows.
 * <p>
 * Reset tokens are stateless JWTs carrying the user's credentials version. Any
 * password change bumps the version, which retires every token issued before it.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordResetService {

    private final UserRepository userRepository;
    private final JwtTokenProvider tokenProvider;
    private final PasswordHasher passwordHasher;
    private final EmailService emailService;

    /**
     * Completes identically whether or not the account exists. Any non-deleted
     * account gets the email, including one whose active flag is off.
     */
    public Mono<Void> requestPasswordReset(String email) {
        return userRepository.findActiveByEmail(AuthService.normalizeEmail(email))
                .flatMap(user -> {
                    String token = tokenProvider.generatePasswordResetToken(
                            user.getId(), user.getCredentialsVersion());
                    return emailService.sendPasswordResetEmail(user.getEmail(), user.getUsername(), token)
                            .doOnSuccess(v -> log.debug("Password reset email sent to user id={}", user.getId()));
                })
                .onErrorResume(e -> {
                    log.warn("Password reset request failed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    @Transactional
    public Mono<Void> resetPassword(String token, String newPassword) {
        var validation = tokenProvider.validatePasswordResetToken(token);
        if (!validation.valid()) {
            return Mono.error(new InvalidTokenException("error.invalid_or_expired_token"));
        }
        Long userId = validation.userId();
        Integer tokenVersion = credentialsVersion(validation.claims());

        return userRepository.findActiveById(userId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", userId)))
                .flatMap(user -> {
                    if (tokenVersion == null || !tokenVersion.equals(user.getCredentialsVersion())) {
                        log.warn("Stale reset token presented for user id={}", userId);
                        return Mono.<User>error(new InvalidTokenException("error.invalid_or_expired_token"));
                    }
                    return passwordHasher.hash(newPassword)
                            .flatMap(hash -> {
                                user.setPasswordHash(hash);
                                user.rotateCredentials();
                                user.stampUpdated(userId, LocalDateTime.now());
                                return userRepository.save(user);
                            });
                })
                .doOnSuccess(user -> log.info("Password reset completed for user id={}", userId))
                .flatMap(user -> emailService.sendPasswordChangedNotification(user.getEmail(), user.getUsername())
                        .onErrorResume(e -> {
                            log.warn("Failed to send password changed notification to {}: {}",
                                    user.getEmail(), e.getMessage());
                            return Mono.empty();
                        }));
    }

    private static Integer credentialsVersion(Claims claims) {
        Object value = claims.get(JwtTokenProvider.CREDENTIALS_VERSION_CLAIM);
        return value instanceof Number number ? number.intValue() : null;
    }
}
