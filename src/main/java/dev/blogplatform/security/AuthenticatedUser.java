package dev.blogplatform.security;

/**
 * Principal placed in the security context once an access token verifies.
 * Carries only the subject; the {@link dev.blogplatform.entity.User} row is loaded on demand.
 */
public record AuthenticatedUser(Long userId) {
}
