package com.delta.warmup.placement.provider;

import com.delta.warmup.config.WarmupConfig;
import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.NotFoundException;
import com.delta.warmup.placement.error.ProviderAuthException;
import com.delta.warmup.placement.error.ProviderTransportException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.http.ProviderHttpClient;
import com.delta.warmup.placement.model.DeliveryStatus;
import com.delta.warmup.placement.model.Placements;
import com.delta.warmup.placement.model.PlacementTestStatus;
import com.delta.warmup.placement.model.ProviderTestCreation;
import com.delta.warmup.placement.model.ProviderTestResults;
import com.delta.warmup.placement.model.TestSummary;
import com.delta.warmup.placement.service.PlacementScoring;
import com.delta.warmup.placement.util.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailGuardProviderClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        objectMapper = new WarmupConfig().objectMapper();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void createTestPostsDomainAndParsesSeedAddresses() throws Exception {
        server.enqueue(json(200, """
            {"data": {
              "uuid": "eg-123",
              "status": "pending",
              "filter_phrase": "warmup-7f3a",
              "test_emails": [
                {"email": "seed1@gmail.com", "provider": "Google"},
                {"email": "seed2@outlook.com", "provider": "Microsoft"}
              ]
            }}
            """));
        EmailGuardProviderClient client = client("secret-key");

        ProviderTestCreation creation = client.createTest("example.com");

        assertThat(creation.testId()).isEqualTo("eg-123");
        assertThat(creation.status()).isEqualTo(PlacementTestStatus.CREATED);
        assertThat(creation.seedPhrase()).isEqualTo("warmup-7f3a");
        assertThat(creation.testAddresses()).containsExactly("seed1@gmail.com", "seed2@outlook.com");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v1/inbox-placement-tests");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-key");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("name").asText()).isEqualTo("Placement Test - example.com");
    }

    @Test
    void getResultsMapsProviderStatuses() throws Exception {
        server.enqueue(json(200, """
            {"data": {
              "uuid": "eg-123",
              "status": "completed",
              "overall_score": 84.6,
              "test_emails": [
                {"email": "a@gmail.com", "status": "received", "folder": "INBOX"},
                {"email": "b@yahoo.com", "status": "received", "folder": "Bulk"},
                {"email": "c@outlook.com", "status": "waiting_for_email", "folder": null}
              ]
            }}
            """));
        EmailGuardProviderClient client = client("secret-key");

        ProviderTestResults results = client.getResults("eg-123");

        assertThat(results.status()).isEqualTo(PlacementTestStatus.COMPLETED);
        assertThat(results.overallScore()).isEqualTo(84.6);
        assertThat(results.testAddresses())
            .extracting(outcome -> outcome.deliveryStatus())
            .containsExactly(DeliveryStatus.DELIVERED, DeliveryStatus.DELIVERED, DeliveryStatus.NOT_RECEIVED);
        assertThat(results.testAddresses().get(1).folder()).isEqualTo("Bulk");
        assertThat(results.testAddresses().get(2).folder()).isNull();
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v1/inbox-placement-tests/eg-123");
    }

    @Test
    void receivedMailInTheSpamFolderCountsAsSpam() {
        server.enqueue(json(200, """
            {"data": {
              "uuid": "eg-456",
              "status": "completed",
              "overall_score": 78,
              "test_emails": [
                {"email": "s1@gmail.com", "status": "received", "folder": "inbox"},
                {"email": "s2@gmail.com", "status": "received", "folder": "inbox"},
                {"email": "s3@gmail.com", "status": "received", "folder": "inbox"},
                {"email": "s4@gmail.com", "status": "received", "folder": "inbox"},
                {"email": "s5@outlook.com", "status": "received", "folder": "inbox"},
                {"email": "s6@outlook.com", "status": "received", "folder": "inbox"},
                {"email": "s7@yahoo.com", "status": "received", "folder": "inbox"},
                {"email": "s8@yahoo.com", "status": "received", "folder": "inbox"},
                {"email": "s9@yahoo.com", "status": "received", "folder": "spam"},
                {"email": "s10@aol.com", "status": "not_received", "folder": null}
              ]
            }}
            """));
        EmailGuardProviderClient client = client("secret-key");

        ProviderTestResults results = client.getResults("eg-456");
        TestSummary summary = PlacementScoring.summarize(
            results.overallScore(), results.testAddresses(), Instant.parse("2024-03-15T10:00:00Z"));

        assertThat(summary.placements()).isEqualTo(new Placements(80.0, 10.0, 10.0));
        assertThat(summary.score()).isEqualTo(78);
        assertThat(summary.recommendations()).hasSize(2);
        assertThat(summary.recommendations().get(0)).startsWith("High spam placement rate");
        assertThat(summary.recommendations().get(1)).startsWith("Significant delivery failures");
    }

    @Test
    void processingStatusIsInProgressWithoutScore() {
        server.enqueue(json(200, "{\"data\": {\"uuid\": \"eg-1\", \"status\": \"processing\", \"test_emails\": []}}"));
        EmailGuardProviderClient client = client("secret-key");

        ProviderTestResults results = client.getResults("eg-1");

        assertThat(results.status()).isEqualTo(PlacementTestStatus.IN_PROGRESS);
        assertThat(results.overallScore()).isNull();
    }

    @Test
    void authFailureHaltsFurtherCallsUntilReconfigured() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\": \"token abc invalid\"}"));
        EmailGuardProviderClient client = client("bad-key");

        assertThatThrownBy(() -> client.createTest("example.com"))
            .isInstanceOf(ProviderAuthException.class)
            .hasMessageNotContaining("token abc");
        assertThat(client.isHalted()).isTrue();

        assertThatThrownBy(() -> client.getResults("eg-1")).isInstanceOf(ProviderAuthException.class);
        assertThat(server.getRequestCount()).isEqualTo(1);

        server.enqueue(json(200, "{\"data\": {\"uuid\": \"eg-1\", \"status\": \"in_progress\"}}"));
        client.reconfigure("good-key");

        assertThat(client.getResults("eg-1").status()).isEqualTo(PlacementTestStatus.IN_PROGRESS);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void missingApiKeyFailsWithoutNetworkCall() {
        EmailGuardProviderClient client = client(null);

        assertThatThrownBy(() -> client.createTest("example.com")).isInstanceOf(ProviderAuthException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void httpErrorsMapToTypedFailures() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(422).setBody("{\"errors\": {\"name\": [\"taken\"]}}"));
        EmailGuardProviderClient client = client("secret-key");

        assertThatThrownBy(() -> client.getResults("eg-1"))
            .isInstanceOfSatisfying(ProviderTransportException.class, error -> {
                assertThat(error.isRetryable()).isTrue();
                assertThat(error.reason()).isEqualTo(ProviderTransportException.Reason.SERVER_ERROR);
            });
        assertThatThrownBy(() -> client.getResults("eg-1"))
            .isInstanceOfSatisfying(ProviderTransportException.class, error ->
                assertThat(error.reason()).isEqualTo(ProviderTransportException.Reason.RATE_LIMITED));
        assertThatThrownBy(() -> client.getResults("eg-1")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> client.createTest("example.com"))
            .isInstanceOf(ValidationException.class)
            .hasMessageNotContaining("taken");
    }

    @Test
    void unreadableBodyIsNotRetryable() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));
        EmailGuardProviderClient client = client("secret-key");

        assertThatThrownBy(() -> client.getResults("eg-1"))
            .isInstanceOfSatisfying(ProviderTransportException.class, error -> {
                assertThat(error.isRetryable()).isFalse();
                assertThat(error.reason()).isEqualTo(ProviderTransportException.Reason.MALFORMED_RESPONSE);
            });
    }

    private EmailGuardProviderClient client(String apiKey) {
        WarmupProperties properties = new WarmupProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getProviders().getEmailguard().setBaseUrl(server.url("/").toString());
        properties.getProviders().getEmailguard().setApiKey(apiKey);
        ProviderHttpClient httpClient = new ProviderHttpClient(properties, executor);
        return new EmailGuardProviderClient(properties, httpClient, objectMapper, Clock.systemUTC(), Sleeper.system());
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
