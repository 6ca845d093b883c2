package dev.blogplatform.exception;

/**
 * Uniqueness violation (email, username, slug, name). Mapped to 400.
 * The message is either a message key or a composed description.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String messageKey) {
        super(messageKey);
    }

    public DuplicateResourceException(String resourceName, String fieldName, Object value) {
        super(String.format("%s with %s '%s' already exists", resourceName, fieldName, value));
    }
}
