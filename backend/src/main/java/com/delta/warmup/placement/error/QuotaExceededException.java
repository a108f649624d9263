package com.delta.warmup.placement.error;

public class QuotaExceededException extends WarmupException {
    private final int quota;

    public QuotaExceededException(int quota) {
        super(ErrorKind.QUOTA_EXCEEDED, "Monthly test quota of " + quota + " exceeded");
        this.quota = quota;
    }

    public int quota() {
        return quota;
    }
}
