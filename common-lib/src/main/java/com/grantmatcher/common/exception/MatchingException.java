package com.grantmatcher.common.exception;

public class MatchingException extends RuntimeException {
    private final ErrorKind kind;

    public MatchingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MatchingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MatchingException validation(String message) {
        return new MatchingException(ErrorKind.VALIDATION_FAILURE, message);
    }

    public static MatchingException notFound(String message) {
        return new MatchingException(ErrorKind.NOT_FOUND, message);
    }

    public static MatchingException upstream(String message, Throwable cause) {
        return new MatchingException(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
