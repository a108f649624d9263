package com.delta.warmup.placement.api;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.ProviderStatusResponse;
import com.delta.warmup.placement.model.ProviderType;
import com.delta.warmup.placement.provider.EmailGuardProviderClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of provider credentials. Replacing the EmailGuard key also lifts a halt caused by a
 * rejected key.
 */
@RestController
@RequestMapping("/api/providers")
public class ProviderAdminController {
    private final EmailGuardProviderClient emailGuardClient;
    private final WarmupProperties properties;

    public ProviderAdminController(EmailGuardProviderClient emailGuardClient, WarmupProperties properties) {
        this.emailGuardClient = emailGuardClient;
        this.properties = properties;
    }

    @GetMapping("/emailguard")
    public ProviderStatusResponse emailGuardStatus() {
        return new ProviderStatusResponse(
            ProviderType.EMAILGUARD.key(),
            properties.getProviders().getEmailguard().isEnabled(),
            emailGuardClient.hasApiKey(),
            emailGuardClient.isHalted()
        );
    }

    @PutMapping("/emailguard/credentials")
    public ProviderStatusResponse updateEmailGuardCredentials(@RequestBody ProviderCredentialsRequest request) {
        if (request == null || request.apiKey() == null || request.apiKey().isBlank()) {
            throw new ValidationException("apiKey is required");
        }
        emailGuardClient.reconfigure(request.apiKey());
        return emailGuardStatus();
    }
}
