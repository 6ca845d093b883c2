package dev.blogplatform.service;

import dev.blogplatform.dto.UserResponse;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.UserRepository;
import dev.blogplatform.security.AuthorizationGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final AuthorizationGuard authorizationGuard;

    public Mono<UserResponse> getCurrentUser(Long userId) {
        return authorizationGuard.resolveIdentity(userId)
                .map(UserResponse::fromEntity);
    }

    public Mono<UserResponse> getUserById(Long id) {
        return userRepository.findActiveById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)))
                .map(UserResponse::fromEntity);
    }
}
