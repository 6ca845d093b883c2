package dev.blogplatform.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. All entities using Snowflake IDs
 * with {@link org.springframework.data.domain.Persistable} implement this
 * so {@link dev.blogplatform.config.PersistableEntityCallback} can flip the
 * flag without reflection.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
