package dev.blogplatform.dto;

import dev.blogplatform.entity.Post;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {

    private String id;
    private String title;
    private String slug;
    private String content;
    private String excerpt;
    private String authorId;
    private String categoryId;
    private Boolean isPublished;
    private LocalDateTime publishedAt;
    private String featuredImageUrl;
    private Long viewCount;
    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;

    private UserResponse author;
    private CategoryResponse category;
    @Builder.Default
    private List<TagResponse> tags = List.of();

    public static PostResponse fromEntity(Post post) {
        return PostResponse.builder()
                .id(String.valueOf(post.getId()))
                .title(post.getTitle())
                .slug(post.getSlug())
                .content(post.getContent())
                .excerpt(post.getExcerpt())
                .authorId(String.valueOf(post.getAuthorId()))
                .categoryId(post.getCategoryId() != null ? String.valueOf(post.getCategoryId()) : null)
                .isPublished(post.getPublished())
                .publishedAt(post.getPublishedAt())
                .featuredImageUrl(post.getFeaturedImageUrl())
                .viewCount(post.getViewCount())
                .dateAdded(post.getDateAdded())
                .dateUpdated(post.getDateUpdated())
                .build();
    }
}
