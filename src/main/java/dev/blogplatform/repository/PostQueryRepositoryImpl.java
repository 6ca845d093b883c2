package dev.blogplatform.repository;

import dev.blogplatform.entity.Post;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the listing SQL from {@link PostSearchCriteria} with named bind
 * parameters only; user input never reaches the SQL text.
 */
@Repository
@RequiredArgsConstructor
public class PostQueryRepositoryImpl implements PostQueryRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String SEARCH_CLAUSE =
            " AND (LOWER(p.title) LIKE :pattern OR LOWER(p.content) LIKE :pattern OR LOWER(p.excerpt) LIKE :pattern)";

    @Override
    public Flux<Post> findByCriteria(PostSearchCriteria criteria) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String sql = "SELECT p.* FROM posts p" + whereClause(criteria, binds)
                + " ORDER BY p.date_added DESC, p.id DESC LIMIT :limit OFFSET :offset";
        binds.put("limit", criteria.limit());
        binds.put("offset", criteria.offset());

        return bindAll(r2dbcTemplate.getDatabaseClient().sql(sql), binds)
                .map((row, meta) -> {
                    Post post = r2dbcTemplate.getConverter().read(Post.class, row, meta);
                    post.setNewRecord(false);
                    return post;
                })
                .all();
    }

    private String whereClause(PostSearchCriteria criteria, Map<String, Object> binds) {
        StringBuilder where = new StringBuilder(" WHERE p.deleted_at IS NULL");
        if (criteria.publishedOnly()) {
            where.append(" AND p.is_published = TRUE");
        }
        if (criteria.categoryId() != null) {
            where.append(" AND p.category_id = :categoryId");
            binds.put("categoryId", criteria.categoryId());
        }
        if (criteria.authorId() != null) {
            where.append(" AND p.author_id = :authorId");
            binds.put("authorId", criteria.authorId());
        }
        if (criteria.tagId() != null) {
            where.append(" AND EXISTS (SELECT 1 FROM post_tags pt WHERE pt.post_id = p.id AND pt.tag_id = :tagId)");
            binds.put("tagId", criteria.tagId());
        }
        if (criteria.query() != null && !criteria.query().isBlank()) {
            where.append(SEARCH_CLAUSE);
            binds.put("pattern", "%" + escapeLike(criteria.query().trim().toLowerCase(Locale.ROOT)) + "%");
        }
        return where.toString();
    }

    private static DatabaseClient.GenericExecuteSpec bindAll(DatabaseClient.GenericExecuteSpec spec,
                                                             Map<String, Object> binds) {
        for (Map.Entry<String, Object> bind : binds.entrySet()) {
            spec = spec.bind(bind.getKey(), bind.getValue());
        }
        return spec;
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
