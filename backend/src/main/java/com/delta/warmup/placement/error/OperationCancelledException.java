package com.delta.warmup.placement.error;

public class OperationCancelledException extends WarmupException {
    public OperationCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
