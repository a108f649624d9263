package com.delta.warmup.placement.error;

public class NotFoundException extends WarmupException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
