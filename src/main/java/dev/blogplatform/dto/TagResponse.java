package dev.blogplatform.dto;

import dev.blogplatform.entity.Tag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagResponse {

    private String id;
    private String name;
    private String slug;
    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;

    public static TagResponse fromEntity(Tag tag) {
        return TagResponse.builder()
                .id(String.valueOf(tag.getId()))
                .name(tag.getName())
                .slug(tag.getSlug())
                .dateAdded(tag.getDateAdded())
                .dateUpdated(tag.getDateUpdated())
                .build();
    }
}
