package dev.blogplatform.exception;

/**
 * Password-reset token that failed verification, expired or was already used.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String messageKey) {
        super(messageKey);
    }
}
