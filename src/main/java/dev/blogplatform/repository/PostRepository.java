package dev.blogplatform.repository;

import dev.blogplatform.entity.Post;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Single-post access. Filtered listings and search go through {@link PostQueryRepository}.
 */
@Repository
public interface PostRepository extends ReactiveCrudRepository<Post, Long> {

    @Query("SELECT * FROM posts WHERE id = :id AND deleted_at IS NULL")
    Mono<Post> findActiveById(Long id);

    @Query("SELECT * FROM posts WHERE slug = :slug AND deleted_at IS NULL")
    Mono<Post> findActiveBySlug(String slug);

    Mono<Boolean> existsBySlug(String slug);

    @Modifying
    @Query("UPDATE posts SET view_count = view_count + 1 WHERE id = :id AND deleted_at IS NULL")
    Mono<Integer> incrementViewCount(Long id);

    @Query("SELECT COUNT(*) FROM posts WHERE deleted_at IS NULL AND is_published = TRUE")
    Mono<Long> countPublished();
}
