package dev.blogplatform.dto;

import dev.blogplatform.entity.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryResponse {

    private String id;
    private String name;
    private String slug;
    private String description;
    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;

    public static CategoryResponse fromEntity(Category category) {
        return CategoryResponse.builder()
                .id(String.valueOf(category.getId()))
                .name(category.getName())
                .slug(category.getSlug())
                .description(category.getDescription())
                .dateAdded(category.getDateAdded())
                .dateUpdated(category.getDateUpdated())
                .build();
    }
}
