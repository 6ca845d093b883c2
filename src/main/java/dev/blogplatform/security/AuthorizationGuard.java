package dev.blogplatform.security;

import dev.blogplatform.entity.User;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Resolves the authenticated principal to its user row and enforces
 * per-resource ownership before mutating operations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthorizationGuard {

    private final UserRepository userRepository;

    /**
     * Loads the non-deleted user behind a verified token. A token whose user is
     * gone yields {@link ResourceNotFoundException} (404), not 401.
     */
    public Mono<User> resolveIdentity(Long userId) {
        return userRepository.findActiveById(userId)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Token subject {} has no active user", userId);
                    return Mono.error(new ResourceNotFoundException("User", "id", userId));
                }));
    }

    /**
     * Emits the resource when the policy allows the actor to mutate it, otherwise
     * fails with {@link AccessDeniedException} (403).
     */
    public <T> Mono<T> requireOwner(T resource, Long actorId, OwnershipPolicy<T> policy, String action) {
        if (policy.permits(resource, actorId)) {
            return Mono.just(resource);
        }
        log.warn("User {} denied: {}", actorId, action);
        return Mono.error(new AccessDeniedException("Not authorized to " + action));
    }
}
