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

@Table("users")
@Getter
@Setter
@ToString(exclude = "passwordHash")
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User implements Persistable<Long>, AuditedEntity {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String email;
    private String username;
    private String fullName;
    private String passwordHash;
    private String bio;
    private String profileImageUrl;

    @Column("is_active")
    @Builder.Default
    private Boolean active = true;

    @Column("is_verified")
    @Builder.Default
    private Boolean verified = false;

    /** Bumped on every password change; reset tokens carry the value they were issued against. */
    @Builder.Default
    private Integer credentialsVersion = 0;

    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;
    private Long addedBy;
    private Long updatedBy;
    private LocalDateTime deletedAt;

    public void rotateCredentials() {
        this.credentialsVersion = (credentialsVersion == null ? 0 : credentialsVersion) + 1;
    }
}
