package com.delta.warmup.placement.error;

public class ValidationException extends WarmupException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    protected ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
