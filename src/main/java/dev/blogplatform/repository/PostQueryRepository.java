package dev.blogplatform.repository;

import dev.blogplatform.entity.Post;
import reactor.core.publisher.Flux;

/**
 * Post listings whose WHERE clause depends on which filters are present.
 * Results never include soft-deleted posts and are ordered newest first.
 */
public interface PostQueryRepository {

    Flux<Post> findByCriteria(PostSearchCriteria criteria);
}
