package dev.blogplatform.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update: only non-null fields are applied. A non-null {@code tagIds}
 * replaces the post's whole tag set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostUpdateRequest {

    @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
    private String title;

    @Size(min = 1, max = 255, message = "Slug must be between 1 and 255 characters")
    private String slug;

    @Size(min = 1, message = "Content must not be empty")
    private String content;

    @Size(max = 500, message = "Excerpt must not exceed 500 characters")
    private String excerpt;

    private String categoryId;
    private Boolean isPublished;

    @Size(max = 500, message = "Featured image URL must not exceed 500 characters")
    private String featuredImageUrl;

    private List<String> tagIds;
}
