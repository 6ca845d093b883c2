package dev.blogplatform.exception;

/**
 * Current password presented on change-password did not match.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String messageKey) {
        super(messageKey);
    }
}
