package com.delta.warmup.placement.api;

public record TransitionRequest(String target) {
}
