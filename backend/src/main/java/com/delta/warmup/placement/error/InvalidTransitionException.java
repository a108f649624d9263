package com.delta.warmup.placement.error;

import com.delta.warmup.placement.model.DomainStatus;

public class InvalidTransitionException extends ValidationException {
    private final DomainStatus from;
    private final DomainStatus to;

    public InvalidTransitionException(DomainStatus from, DomainStatus to) {
        super(ErrorKind.INVALID_TRANSITION, "Transition " + from + " -> " + to + " is not allowed");
        this.from = from;
        this.to = to;
    }

    public DomainStatus from() {
        return from;
    }

    public DomainStatus to() {
        return to;
    }
}
