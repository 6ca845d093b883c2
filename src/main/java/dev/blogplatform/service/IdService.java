package dev.blogplatform.service;

import dev.blogplatform.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Hands out primary keys for new rows.
 *
 * <pre>
 * Post post = Post.builder()
 *     .id(idService.nextId())
 *     .title("My Post")
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
