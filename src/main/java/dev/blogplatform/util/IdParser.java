package dev.blogplatform.util;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Parses the string ids clients send back in request bodies. Snowflake ids travel
 * as JSON strings because they do not fit a JavaScript number.
 */
public final class IdParser {

    private IdParser() {
        // Utility class
    }

    /**
     * @return the id, or {@code null} when the value is null or blank
     * @throws IllegalArgumentException when the value is not a positive number
     */
    public static Long parseNullable(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long id = Long.parseLong(value.trim());
            if (id <= 0) {
                throw new IllegalArgumentException("Invalid " + fieldName + ": " + value);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + fieldName + ": " + value);
        }
    }

    public static List<Long> parseAll(Collection<String> values, String fieldName) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(value -> parseNullable(value, fieldName))
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }
}
