package com.delta.warmup.placement.provider;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.ProviderAuthException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.error.WarmupException;
import com.delta.warmup.placement.http.ProviderHttpClient;
import com.delta.warmup.placement.http.TokenBucketRateLimiter;
import com.delta.warmup.placement.model.DeliveryStatus;
import com.delta.warmup.placement.model.HttpFetchResult;
import com.delta.warmup.placement.model.PlacementTestStatus;
import com.delta.warmup.placement.model.ProviderTestCreation;
import com.delta.warmup.placement.model.ProviderTestResults;
import com.delta.warmup.placement.model.ProviderType;
import com.delta.warmup.placement.model.TestEmailOutcome;
import com.delta.warmup.placement.util.Sleeper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class EmailGuardProviderClient implements PlacementProviderClient {
    private static final Logger log = LoggerFactory.getLogger(EmailGuardProviderClient.class);
    private static final String TESTS_PATH = "/api/v1/inbox-placement-tests";

    private final WarmupProperties.EmailGuard config;
    private final ProviderHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TokenBucketRateLimiter rateLimiter;
    private final String providerName = ProviderType.EMAILGUARD.displayName();

    private volatile String apiKey;
    private volatile boolean authHalted;

    public EmailGuardProviderClient(
        WarmupProperties properties,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper,
        Clock clock,
        Sleeper sleeper
    ) {
        this.config = properties.getProviders().getEmailguard();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = new TokenBucketRateLimiter(
            "emailguard",
            config.getMaxRequestsPerInterval(),
            config.getMaxRequestsPerInterval(),
            config.getIntervalMs(),
            properties.getRateLimit().getMaxWaitMs(),
            clock,
            sleeper
        );
        this.apiKey = config.getApiKey();
    }

    @Override
    public ProviderType type() {
        return ProviderType.EMAILGUARD;
    }

    public boolean isHalted() {
        return authHalted;
    }

    public boolean hasApiKey() {
        String key = apiKey;
        return key != null && !key.isBlank();
    }

    public synchronized void reconfigure(String newApiKey) {
        this.apiKey = newApiKey == null ? null : newApiKey.trim();
        this.authHalted = false;
        log.info("EmailGuard client reconfigured with a new API key");
    }

    @Override
    public ProviderTestCreation createTest(String domainName) {
        if (domainName == null || domainName.isBlank()) {
            throw new ValidationException("Domain name is required");
        }
        Map<String, String> headers = authorizedHeaders();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", "Placement Test - " + domainName);
        rateLimiter.acquire();
        HttpFetchResult result = httpClient.postJson(config.getBaseUrl() + TESTS_PATH, body.toString(), headers);
        JsonNode data = readData(result, "createTest");

        String testId = text(data, "uuid");
        if (testId == null) {
            throw ProviderErrorMapper.malformed(providerName, "createTest");
        }
        PlacementTestStatus status = mapTestStatus(text(data, "status"));
        List<String> addresses = new ArrayList<>();
        for (JsonNode email : data.path("test_emails")) {
            String address = text(email, "email");
            if (address != null) {
                addresses.add(address);
            }
        }
        log.info("EmailGuard test {} created for {} with {} seed addresses", testId, domainName, addresses.size());
        return new ProviderTestCreation(testId, status, text(data, "filter_phrase"), addresses);
    }

    @Override
    public ProviderTestResults getResults(String providerTestId) {
        if (providerTestId == null || providerTestId.isBlank()) {
            throw new ValidationException("Provider test id is required");
        }
        Map<String, String> headers = authorizedHeaders();
        rateLimiter.acquire();
        String url = config.getBaseUrl() + TESTS_PATH + "/"
            + URLEncoder.encode(providerTestId.trim(), StandardCharsets.UTF_8);
        HttpFetchResult result = httpClient.getJson(url, headers);
        JsonNode data = readData(result, "getResults");

        JsonNode scoreNode = data.get("overall_score");
        Double overallScore = scoreNode != null && scoreNode.isNumber() ? scoreNode.asDouble() : null;
        List<TestEmailOutcome> outcomes = new ArrayList<>();
        for (JsonNode email : data.path("test_emails")) {
            String address = text(email, "email");
            if (address == null) {
                continue;
            }
            outcomes.add(new TestEmailOutcome(address, mapDeliveryStatus(text(email, "status")), text(email, "folder")));
        }
        return new ProviderTestResults(overallScore, mapTestStatus(text(data, "status")), outcomes);
    }

    static PlacementTestStatus mapTestStatus(String raw) {
        if (raw == null) {
            return PlacementTestStatus.CREATED;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "created", "pending" -> PlacementTestStatus.CREATED;
            case "completed" -> PlacementTestStatus.COMPLETED;
            case "failed" -> PlacementTestStatus.FAILED;
            default -> PlacementTestStatus.IN_PROGRESS;
        };
    }

    static DeliveryStatus mapDeliveryStatus(String raw) {
        if (raw == null) {
            return DeliveryStatus.NOT_RECEIVED;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "received", "delivered", "inbox" -> DeliveryStatus.DELIVERED;
            case "spam" -> DeliveryStatus.SPAM;
            default -> DeliveryStatus.NOT_RECEIVED;
        };
    }

    private Map<String, String> authorizedHeaders() {
        if (authHalted) {
            throw new ProviderAuthException(providerName, "EmailGuard calls are halted after an authentication failure");
        }
        String key = apiKey;
        if (key == null || key.isBlank()) {
            throw new ProviderAuthException(providerName, "EmailGuard API key is not configured");
        }
        return Map.of("Authorization", "Bearer " + key);
    }

    private JsonNode readData(HttpFetchResult result, String operation) {
        if (result == null || !result.isSuccessful()) {
            WarmupException error = ProviderErrorMapper.fromResult(providerName, operation, result);
            if (error instanceof ProviderAuthException) {
                authHalted = true;
                log.warn("EmailGuard rejected credentials during {}; halting further calls", operation);
            }
            throw error;
        }
        if (result.body() == null || result.body().isBlank()) {
            throw ProviderErrorMapper.malformed(providerName, operation);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw ProviderErrorMapper.malformed(providerName, operation);
        }
        if (root == null || !root.isObject()) {
            throw ProviderErrorMapper.malformed(providerName, operation);
        }
        JsonNode data = root.get("data");
        return data != null && data.isObject() ? data : root;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
