package com.delta.warmup.placement.model;

import java.util.List;

public record ProviderTestResults(
    Double overallScore,
    PlacementTestStatus status,
    List<TestEmailOutcome> testAddresses
) {
    public ProviderTestResults {
        testAddresses = testAddresses == null ? List.of() : List.copyOf(testAddresses);
    }
}
