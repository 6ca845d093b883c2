package dev.blogplatform.security;

/**
 * Purpose marker carried in the {@code kind} claim. A token is only accepted by
 * the verification path matching its kind.
 */
public enum TokenKind {
    ACCESS("access"),
    PASSWORD_RESET("password_reset");

    public static final String CLAIM = "kind";

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
