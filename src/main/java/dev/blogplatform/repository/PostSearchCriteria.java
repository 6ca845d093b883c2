package dev.blogplatform.repository;

import lombok.Builder;

/**
 * Filters for post listings. Null fields are not applied.
 *
 * @param query case-insensitive substring matched against title, content and excerpt
 */
@Builder
public record PostSearchCriteria(
        Long categoryId,
        Long tagId,
        Long authorId,
        String query,
        boolean publishedOnly,
        int offset,
        int limit
) {
}
