package com.delta.warmup.placement.provider;

import com.delta.warmup.placement.error.ProviderNotImplementedException;
import com.delta.warmup.placement.model.ProviderTestCreation;
import com.delta.warmup.placement.model.ProviderTestResults;
import com.delta.warmup.placement.model.ProviderType;
import org.springframework.stereotype.Service;

/**
 * Registered so the key resolves, but Smartlead placement tests are not wired up yet.
 */
@Service
public class SmartleadProviderClient implements PlacementProviderClient {

    @Override
    public ProviderType type() {
        return ProviderType.SMARTLEAD;
    }

    @Override
    public ProviderTestCreation createTest(String domainName) {
        throw new ProviderNotImplementedException(ProviderType.SMARTLEAD.displayName(), "createTest");
    }

    @Override
    public ProviderTestResults getResults(String providerTestId) {
        throw new ProviderNotImplementedException(ProviderType.SMARTLEAD.displayName(), "getResults");
    }
}
