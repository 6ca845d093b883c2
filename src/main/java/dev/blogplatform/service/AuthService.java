package dev.blogplatform.service;

import dev.blogplatform.dto.AuthResponse;
import dev.blogplatform.dto.ChangePasswordRequest;
import dev.blogplatform.dto.SigninRequest;
import dev.blogplatform.dto.SignupRequest;
import dev.blogplatform.dto.UserResponse;
import dev.blogplatform.entity.User;
import dev.blogplatform.exception.AccountInactiveException;
import dev.blogplatform.exception.DuplicateResourceException;
import dev.blogplatform.exception.InvalidCredentialsException;
import dev.blogplatform.metrics.BlogMetrics;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.AuthorizationGuard;
import dev.blogplatform.security.JwtTokenProvider;
import dev.blogplatform.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider tokenProvider;
    private final AuthorizationGuard authorizationGuard;
    private final EmailService emailService;
    private final IdService idService;
    private final BlogMetrics blogMetrics;

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Creates the account and signs it in. Email is checked before username, so a
     * request clashing on both reports the email.
     */
    @Transactional
    public Mono<AuthResponse> register(SignupRequest request) {
        String email = normalizeEmail(request.email());
        String username = request.username().trim();

        return userRepository.existsByEmail(email)
                .flatMap(emailTaken -> {
                    if (emailTaken) {
                        return Mono.<Boolean>error(new DuplicateResourceException("error.email_registered"));
                    }
                    return userRepository.existsByUsername(username);
                })
                .flatMap(usernameTaken -> {
                    if (usernameTaken) {
                        return Mono.<String>error(new DuplicateResourceException("error.username_taken"));
                    }
                    return passwordHasher.hash(request.password());
                })
                .flatMap(passwordHash -> {
                    long id = idService.nextId();
                    User user = User.builder()
                            .id(id)
                            .email(email)
                            .username(username)
                            .fullName(request.fullName())
                            .bio(request.bio())
                            .profileImageUrl(request.profileImageUrl())
                            .passwordHash(passwordHash)
                            .build();
                    user.stampCreated(id, LocalDateTime.now());
                    return userRepository.save(user);
                })
                .doOnSuccess(user -> {
                    log.info("User registered: id={}, username={}", user.getId(), user.getUsername());
                    blogMetrics.incrementUserRegistered();
                })
                .flatMap(user -> emailService.sendWelcomeEmail(user.getEmail(), user.getUsername())
                        .onErrorResume(e -> {
                            log.warn("Failed to send welcome email to {}: {}", user.getEmail(), e.getMessage());
                            return Mono.empty();
                        })
                        .thenReturn(user))
                .map(this::toAuthResponse);
    }

    /**
     * Looks up the non-deleted account and checks the password. Empty for an unknown
     * email and for a wrong password alike.
     */
    public Mono<User> authenticate(String email, String password) {
        return userRepository.findActiveByEmail(normalizeEmail(email))
                .filterWhen(user -> passwordHasher.verify(password, user.getPasswordHash()));
    }

    public Mono<AuthResponse> signin(SigninRequest request) {
        return authenticate(request.email(), request.password())
                .switchIfEmpty(Mono.defer(() -> {
                    blogMetrics.incrementFailedSignin();
                    return Mono.error(new BadCredentialsException("error.invalid_credentials"));
                }))
                .flatMap(user -> {
                    if (!Boolean.TRUE.equals(user.getActive())) {
                        log.warn("Sign-in refused for inactive user id={}", user.getId());
                        return Mono.<AuthResponse>error(new AccountInactiveException("error.account_inactive"));
                    }
                    log.debug("User signed in: id={}", user.getId());
                    return Mono.just(toAuthResponse(user));
                });
    }

    @Transactional
    public Mono<Void> changePassword(Long userId, ChangePasswordRequest request) {
        return authorizationGuard.resolveIdentity(userId)
                .flatMap(user -> passwordHasher.verify(request.oldPassword(), user.getPasswordHash())
                        .flatMap(matches -> {
                            if (!matches) {
                                log.warn("Password change rejected for user id={}: current password mismatch", userId);
                                return Mono.<User>error(new InvalidCredentialsException("error.incorrect_password"));
                            }
                            return passwordHasher.hash(request.newPassword())
                                    .flatMap(hash -> {
                                        user.setPasswordHash(hash);
                                        user.rotateCredentials();
                                        user.stampUpdated(userId, LocalDateTime.now());
                                        return userRepository.save(user);
                                    });
                        }))
                .doOnSuccess(user -> log.info("Password changed for user id={}", userId))
                .flatMap(user -> emailService.sendPasswordChangedNotification(user.getEmail(), user.getUsername())
                        .onErrorResume(e -> {
                            log.warn("Failed to send password changed notification to {}: {}",
                                    user.getEmail(), e.getMessage());
                            return Mono.empty();
                        }));
    }

    private AuthResponse toAuthResponse(User user) {
        return AuthResponse.builder()
                .accessToken(tokenProvider.generateAccessToken(user.getId()))
                .expiresIn(tokenProvider.getAccessTokenTtlSeconds())
                .user(UserResponse.fromEntity(user))
                .build();
    }
}
