package com.alari.companion.security;

public class AuthException extends RuntimeException {

    public enum Reason { MISSING_TOKEN, EXPIRED_TOKEN, MALFORMED_TOKEN, UNKNOWN_SUBJECT, INVALID_CREDENTIALS }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
