package dev.blogplatform.repository;

import dev.blogplatform.entity.Tag;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface TagRepository extends ReactiveCrudRepository<Tag, Long> {

    @Query("SELECT * FROM tags WHERE id = :id AND deleted_at IS NULL")
    Mono<Tag> findActiveById(Long id);

    @Query("SELECT * FROM tags WHERE deleted_at IS NULL ORDER BY date_added DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Tag> findAllActive(int limit, int offset);

    Flux<Tag> findByIdInAndDeletedAtIsNull(Collection<Long> ids);

    Mono<Boolean> existsByName(String name);

    Mono<Boolean> existsBySlug(String slug);
}
