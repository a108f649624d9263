package com.delta.warmup.placement.provider;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.ProviderType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PlacementProviderRegistry {
    private final Map<ProviderType, PlacementProviderClient> clients = new EnumMap<>(ProviderType.class);
    private final WarmupProperties properties;

    public PlacementProviderRegistry(List<PlacementProviderClient> clients, WarmupProperties properties) {
        this.properties = properties;
        for (PlacementProviderClient client : clients) {
            this.clients.put(client.type(), client);
        }
    }

    public PlacementProviderClient resolve(String key) {
        ProviderType type = ProviderType.fromKey(key);
        if (type == null) {
            throw new ValidationException("Unknown placement provider: " + key);
        }
        return resolve(type);
    }

    public PlacementProviderClient resolve(ProviderType type) {
        if (type == null) {
            throw new ValidationException("Placement provider is required");
        }
        if (!isEnabled(type)) {
            throw new ValidationException("Placement provider " + type.key() + " is disabled");
        }
        PlacementProviderClient client = clients.get(type);
        if (client == null) {
            throw new ValidationException("Placement provider " + type.key() + " is not registered");
        }
        return client;
    }

    private boolean isEnabled(ProviderType type) {
        return switch (type) {
            case EMAILGUARD -> properties.getProviders().getEmailguard().isEnabled();
            case SMARTLEAD -> properties.getProviders().getSmartlead().isEnabled();
        };
    }
}
