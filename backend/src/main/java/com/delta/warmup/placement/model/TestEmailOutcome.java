package com.delta.warmup.placement.model;

public record TestEmailOutcome(
    String address,
    DeliveryStatus deliveryStatus,
    String folder
) {
}
