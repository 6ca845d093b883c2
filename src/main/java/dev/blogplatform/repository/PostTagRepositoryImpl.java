package dev.blogplatform.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashSet;

@Repository
@RequiredArgsConstructor
public class PostTagRepositoryImpl implements PostTagRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_LINKS_BY_POST_IDS =
            "SELECT post_id, tag_id FROM post_tags WHERE post_id = ANY(:ids)";

    private static final String INSERT_POST_TAG =
            "INSERT INTO post_tags (post_id, tag_id) VALUES (:postId, :tagId) ON CONFLICT DO NOTHING";

    private static final String DELETE_BY_POST_ID =
            "DELETE FROM post_tags WHERE post_id = :postId";

    @Override
    public Flux<PostTagLink> findLinksByPostIds(Collection<Long> postIds) {
        if (postIds.isEmpty()) {
            return Flux.empty();
        }
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_LINKS_BY_POST_IDS)
                .bind("ids", postIds.toArray(new Long[0]))
                .map((row, meta) -> new PostTagLink(
                        row.get("post_id", Long.class),
                        row.get("tag_id", Long.class)))
                .all();
    }

    @Override
    public Mono<Void> replaceTags(Long postId, Collection<Long> tagIds) {
        return deleteByPostId(postId)
                .thenMany(Flux.fromIterable(new LinkedHashSet<>(tagIds)))
                .concatMap(tagId -> r2dbcTemplate.getDatabaseClient()
                        .sql(INSERT_POST_TAG)
                        .bind("postId", postId)
                        .bind("tagId", tagId)
                        .fetch()
                        .rowsUpdated())
                .then();
    }

    @Override
    public Mono<Void> deleteByPostId(Long postId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_POST_ID)
                .bind("postId", postId)
                .fetch()
                .rowsUpdated()
                .then();
    }
}
