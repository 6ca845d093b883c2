package dev.blogplatform.security;

import dev.blogplatform.entity.Post;
import dev.blogplatform.entity.User;
import dev.blogplatform.exception.ResourceNotFoundException;
import dev.blogplatform.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationGuardTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private AuthorizationGuard authorizationGuard;

    @Nested
    @DisplayName("resolveIdentity")
    class ResolveIdentity {

        @Test
        @DisplayName("Should return the active user behind the token")
        void shouldReturnUser() {
            User user = User.builder().id(1L).username("alice").build();
            when(userRepository.findActiveById(1L)).thenReturn(Mono.just(user));

            StepVerifier.create(authorizationGuard.resolveIdentity(1L))
                    .expectNext(user)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with 404 when the user no longer exists")
        void shouldFailWhenUserGone() {
            when(userRepository.findActiveById(1L)).thenReturn(Mono.empty());

            StepVerifier.create(authorizationGuard.resolveIdentity(1L))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(ResourceNotFoundException.class)
                            .hasMessage("User not found"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("requireOwner")
    class RequireOwner {

        private final OwnershipPolicy<Post> policy = OwnershipPolicy.authoredBy(Post::getAuthorId);

        @Test
        @DisplayName("Should pass the resource through for its author")
        void shouldAllowAuthor() {
            Post post = Post.builder().id(10L).authorId(1L).build();

            StepVerifier.create(authorizationGuard.requireOwner(post, 1L, policy, "update this post"))
                    .expectNext(post)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should deny anyone else with 403")
        void shouldDenyOthers() {
            Post post = Post.builder().id(10L).authorId(1L).build();

            StepVerifier.create(authorizationGuard.requireOwner(post, 2L, policy, "update this post"))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(AccessDeniedException.class)
                            .hasMessage("Not authorized to update this post"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("OwnershipPolicy")
    class Policies {

        @Test
        @DisplayName("Permissive policy should admit any authenticated actor but not anonymous")
        void permissivePolicy() {
            OwnershipPolicy<Object> policy = OwnershipPolicy.anyAuthenticatedUser();

            assertThat(policy.permits(new Object(), 99L)).isTrue();
            assertThat(policy.permits(new Object(), null)).isFalse();
        }

        @Test
        @DisplayName("Author policy should not admit a null actor even for authorless resources")
        void authorPolicyRejectsNullActor() {
            OwnershipPolicy<Post> policy = OwnershipPolicy.authoredBy(Post::getAuthorId);

            assertThat(policy.permits(Post.builder().build(), null)).isFalse();
        }
    }
}
