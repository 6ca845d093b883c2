package dev.blogplatform.entity;

import java.time.LocalDateTime;

/**
 * Lifecycle state of a soft-deletable row, derived from its {@code deleted_at} column.
 */
public sealed interface Lifecycle permits Lifecycle.Active, Lifecycle.Deleted {

    Active ACTIVE = new Active();

    static Lifecycle of(LocalDateTime deletedAt) {
        return deletedAt == null ? ACTIVE : new Deleted(deletedAt);
    }

    default boolean isDeleted() {
        return this instanceof Deleted;
    }

    record Active() implements Lifecycle {
    }

    record Deleted(LocalDateTime at) implements Lifecycle {
    }
}
