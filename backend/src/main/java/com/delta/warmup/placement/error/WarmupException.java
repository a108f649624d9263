package com.delta.warmup.placement.error;

public abstract class WarmupException extends RuntimeException {
    private final ErrorKind kind;

    protected WarmupException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WarmupException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
