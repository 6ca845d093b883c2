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

@Table("comments")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment implements Persistable<Long>, AuditedEntity {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String content;
    private Long postId;
    private Long authorId;
    private Long parentCommentId;

    @Column("is_approved")
    @Builder.Default
    private Boolean approved = false;

    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;
    private Long addedBy;
    private Long updatedBy;
    private LocalDateTime deletedAt;
}
