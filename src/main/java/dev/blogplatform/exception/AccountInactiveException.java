package dev.blogplatform.exception;

public class AccountInactiveException extends RuntimeException {

    public AccountInactiveException(String messageKey) {
        super(messageKey);
    }
}
