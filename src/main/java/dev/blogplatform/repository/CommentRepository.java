package dev.blogplatform.repository;

import dev.blogplatform.entity.Comment;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CommentRepository extends ReactiveCrudRepository<Comment, Long> {

    @Query("SELECT * FROM comments WHERE id = :id AND deleted_at IS NULL")
    Mono<Comment> findActiveById(Long id);

    @Query("SELECT * FROM comments WHERE post_id = :postId AND is_approved = TRUE AND deleted_at IS NULL " +
           "ORDER BY date_added DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Comment> findApprovedByPostId(Long postId, int limit, int offset);

    @Query("SELECT COUNT(*) FROM comments WHERE deleted_at IS NULL")
    Mono<Long> countActive();

    @Query("SELECT COUNT(*) FROM comments WHERE is_approved = FALSE AND deleted_at IS NULL")
    Mono<Long> countPending();
}
