package dev.blogplatform.entity;

import java.time.LocalDateTime;

/**
 * Audit columns shared by every table: who created/updated a row, when,
 * and the soft-delete marker. Implemented through Lombok accessors on each entity.
 */
public interface AuditedEntity extends NewRecordAware {

    LocalDateTime getDateAdded();

    void setDateAdded(LocalDateTime dateAdded);

    LocalDateTime getDateUpdated();

    void setDateUpdated(LocalDateTime dateUpdated);

    Long getAddedBy();

    void setAddedBy(Long addedBy);

    Long getUpdatedBy();

    void setUpdatedBy(Long updatedBy);

    LocalDateTime getDeletedAt();

    void setDeletedAt(LocalDateTime deletedAt);

    default void stampCreated(Long actorId, LocalDateTime now) {
        setAddedBy(actorId);
        setDateAdded(now);
        stampUpdated(actorId, now);
    }

    default void stampUpdated(Long actorId, LocalDateTime now) {
        setUpdatedBy(actorId);
        setDateUpdated(now);
    }

    /**
     * Soft delete: the row stays in the table but drops out of every read path.
     */
    default void markDeleted(Long actorId, LocalDateTime now) {
        setDeletedAt(now);
        stampUpdated(actorId, now);
    }

    default Lifecycle lifecycle() {
        return Lifecycle.of(getDeletedAt());
    }
}
