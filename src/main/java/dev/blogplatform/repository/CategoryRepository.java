package dev.blogplatform.repository;

import dev.blogplatform.entity.Category;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CategoryRepository extends ReactiveCrudRepository<Category, Long> {

    @Query("SELECT * FROM categories WHERE id = :id AND deleted_at IS NULL")
    Mono<Category> findActiveById(Long id);

    @Query("SELECT * FROM categories WHERE deleted_at IS NULL ORDER BY date_added DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Category> findAllActive(int limit, int offset);

    Mono<Boolean> existsByName(String name);

    Mono<Boolean> existsBySlug(String slug);

    Mono<Boolean> existsByNameAndIdNot(String name, Long id);

    Mono<Boolean> existsBySlugAndIdNot(String slug, Long id);
}
