package com.delta.warmup.placement.model;

public enum DeliveryStatus {
    DELIVERED,
    SPAM,
    NOT_RECEIVED
}
