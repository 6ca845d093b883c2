package dev.blogplatform.repository;

/**
 * One row of the {@code post_tags} join table.
 */
public record PostTagLink(Long postId, Long tagId) {
}
