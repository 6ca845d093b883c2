package dev.blogplatform.config;

import dev.blogplatform.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks entities loaded through repositories as existing rows, so a later
 * {@code save()} of an entity with a pre-assigned Snowflake ID issues an UPDATE.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware aware) {
            aware.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
