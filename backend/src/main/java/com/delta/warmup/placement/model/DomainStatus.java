package com.delta.warmup.placement.model;

import java.util.Locale;

public enum DomainStatus {
    WARMING,
    ACTIVE,
    INACTIVE;

    public static DomainStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DomainStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
