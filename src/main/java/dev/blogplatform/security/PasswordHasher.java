package dev.blogplatform.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * One-way credential hashing on top of the BCrypt {@link PasswordEncoder}.
 * BCrypt is CPU-bound, so both operations run on {@code boundedElastic}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public Mono<String> hash(String rawPassword) {
        return Mono.fromCallable(() -> passwordEncoder.encode(rawPassword))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Never errors: a null, blank or malformed stored hash simply fails verification.
     */
    public Mono<Boolean> verify(String rawPassword, String storedHash) {
        if (rawPassword == null || storedHash == null || storedHash.isBlank()) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> passwordEncoder.matches(rawPassword, storedHash))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Password hash verification failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
