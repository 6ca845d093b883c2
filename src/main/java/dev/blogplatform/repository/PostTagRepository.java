package dev.blogplatform.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Post-tag many-to-many operations. R2DBC has no join-entity mapping, so the
 * implementation talks to the join table through {@code DatabaseClient}.
 */
public interface PostTagRepository {

    Flux<PostTagLink> findLinksByPostIds(Collection<Long> postIds);

    Mono<Void> replaceTags(Long postId, Collection<Long> tagIds);

    Mono<Void> deleteByPostId(Long postId);
}
