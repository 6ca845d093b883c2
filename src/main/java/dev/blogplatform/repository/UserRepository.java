package dev.blogplatform.repository;

import dev.blogplatform.entity.User;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    @Query("SELECT * FROM users WHERE id = :id AND deleted_at IS NULL")
    Mono<User> findActiveById(Long id);

    @Query("SELECT * FROM users WHERE LOWER(email) = LOWER(:email) AND deleted_at IS NULL")
    Mono<User> findActiveByEmail(String email);

    // Uniqueness checks span deleted rows too: the unique indexes do.
    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE LOWER(email) = LOWER(:email))")
    Mono<Boolean> existsByEmail(String email);

    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE LOWER(username) = LOWER(:username))")
    Mono<Boolean> existsByUsername(String username);

    @Query("SELECT COUNT(*) FROM users WHERE deleted_at IS NULL")
    Mono<Long> countActive();
}
