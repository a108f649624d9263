package com.delta.warmup.placement.provider;

import com.delta.warmup.placement.model.ProviderTestCreation;
import com.delta.warmup.placement.model.ProviderTestResults;
import com.delta.warmup.placement.model.ProviderType;

/**
 * Adapter for an inbox-placement test vendor.
 *
 * <p>Implementations throw the typed {@code WarmupException} subclasses only: transport failures as
 * {@code ProviderTransportException} (retryable or not), rejected credentials as
 * {@code ProviderAuthException}, unknown tests as {@code NotFoundException}.
 */
public interface PlacementProviderClient {
    ProviderType type();

    ProviderTestCreation createTest(String domainName);

    ProviderTestResults getResults(String providerTestId);
}
