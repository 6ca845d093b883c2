package dev.blogplatform.dto;

import dev.blogplatform.entity.Comment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

    private String id;
    private String content;
    private String postId;
    private String authorId;
    private String parentCommentId;
    private Boolean isApproved;
    private UserResponse author;
    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;

    public static CommentResponse fromEntity(Comment comment) {
        return CommentResponse.builder()
                .id(String.valueOf(comment.getId()))
                .content(comment.getContent())
                .postId(String.valueOf(comment.getPostId()))
                .authorId(String.valueOf(comment.getAuthorId()))
                .parentCommentId(comment.getParentCommentId() != null
                        ? String.valueOf(comment.getParentCommentId()) : null)
                .isApproved(comment.getApproved())
                .dateAdded(comment.getDateAdded())
                .dateUpdated(comment.getDateUpdated())
                .build();
    }
}
