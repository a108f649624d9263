package com.delta.warmup.placement.model;

import java.util.List;

public record ProviderTestCreation(
    String testId,
    PlacementTestStatus status,
    String seedPhrase,
    List<String> testAddresses
) {
    public ProviderTestCreation {
        testAddresses = testAddresses == null ? List.of() : List.copyOf(testAddresses);
    }
}
