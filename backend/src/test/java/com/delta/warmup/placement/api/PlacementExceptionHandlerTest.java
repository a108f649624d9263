package com.delta.warmup.placement.api;

import com.delta.warmup.placement.error.ErrorKind;
import com.delta.warmup.placement.error.OperationCancelledException;
import com.delta.warmup.placement.error.ProviderAuthException;
import com.delta.warmup.placement.error.ProviderTransportException;
import com.delta.warmup.placement.error.QuotaExceededException;
import com.delta.warmup.placement.error.RateLimitExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlacementExceptionHandlerTest {
    private final PlacementExceptionHandler handler = new PlacementExceptionHandler();

    @Test
    void rateLimitCarriesRetryAfterInWholeSeconds() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleWarmup(new RateLimitExceededException("slow down", Duration.ofMillis(1500)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
        assertThat(response.getBody())
            .containsEntry("error", ErrorKind.RATE_LIMIT_EXCEEDED.code())
            .containsEntry("retryAfterSeconds", 2L);
    }

    @Test
    void providerAndQuotaFailuresMapToGatewayAndForbidden() {
        assertThat(PlacementExceptionHandler.statusFor(new QuotaExceededException(100)))
            .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(PlacementExceptionHandler.statusFor(new ProviderAuthException("EmailGuard", "rejected")))
            .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(PlacementExceptionHandler.statusFor(new ProviderTransportException(
            "EmailGuard", ProviderTransportException.Reason.NETWORK, "down"))).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(PlacementExceptionHandler.statusFor(new OperationCancelledException("stop", null)))
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleUnexpected(new IllegalStateException("db password is hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "internal_error");
        assertThat(response.getBody().toString()).doesNotContain("hunter2");
    }
}
