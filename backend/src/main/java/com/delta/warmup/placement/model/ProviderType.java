package com.delta.warmup.placement.model;

import java.util.Locale;

public enum ProviderType {
    EMAILGUARD("emailguard", "EmailGuard"),
    SMARTLEAD("smartlead", "Smartlead");

    private final String key;
    private final String displayName;

    ProviderType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static ProviderType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
