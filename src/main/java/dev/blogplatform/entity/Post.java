package dev.blogplatform.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("posts")
@Getter
@Setter
@ToString(exclude = "content")
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post implements Persistable<Long>, AuditedEntity {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String title;
    private String slug;
    private String content;
    private String excerpt;
    private Long authorId;
    private Long categoryId;

    @Column("is_published")
    @Builder.Default
    private Boolean published = false;

    private LocalDateTime publishedAt;
    private String featuredImageUrl;

    @Builder.Default
    private Long viewCount = 0L;

    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;
    private Long addedBy;
    private Long updatedBy;
    private LocalDateTime deletedAt;

    /**
     * Sets the published flag, stamping {@code publishedAt} the first time the post goes live.
     */
    public void applyPublished(boolean publish, LocalDateTime now) {
        this.published = publish;
        if (publish && publishedAt == null) {
            this.publishedAt = now;
        }
    }
}
