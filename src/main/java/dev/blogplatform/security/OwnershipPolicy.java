package dev.blogplatform.security;

import java.util.Objects;
import java.util.function.Function;

/**
 * Decides whether an acting user may mutate a resource. Each entity kind picks
 * its policy; {@link AuthorizationGuard} enforces it.
 */
@FunctionalInterface
public interface OwnershipPolicy<T> {

    boolean permits(T resource, Long actorId);

    /** Only the user whose id the extractor returns may mutate the resource. */
    static <T> OwnershipPolicy<T> authoredBy(Function<T, Long> authorId) {
        return (resource, actorId) -> actorId != null && Objects.equals(authorId.apply(resource), actorId);
    }

    /** Any authenticated user may mutate the resource. */
    static <T> OwnershipPolicy<T> anyAuthenticatedUser() {
        return (resource, actorId) -> actorId != null;
    }
}
