package com.delta.warmup.placement.api;

import com.delta.warmup.placement.error.RateLimitExceededException;
import com.delta.warmup.placement.error.WarmupException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PlacementExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PlacementExceptionHandler.class);

  @ExceptionHandler(WarmupException.class)
  public ResponseEntity<Map<String, Object>> handleWarmup(WarmupException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", ex.kind().code());
    body.put("message", ex.getMessage());
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusFor(ex));
    if (ex instanceof RateLimitExceededException rateLimited && rateLimited.retryAfter() != null) {
      long seconds = Math.max(1, (rateLimited.retryAfter().toMillis() + 999) / 1000);
      body.put("retryAfterSeconds", seconds);
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
    }
    return builder.body(body);
  }

  @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_error", "message", "Malformed request"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse framework) {
      return ResponseEntity.status(framework.getStatusCode())
          .body(Map.of("error", "request_error", "message", "Request could not be handled"));
    }
    log.error("Unhandled API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "internal_error", "message", "Unexpected error"));
  }

  static HttpStatus statusFor(WarmupException ex) {
    return switch (ex.kind()) {
      case VALIDATION -> HttpStatus.BAD_REQUEST;
      case INVALID_TRANSITION -> HttpStatus.CONFLICT;
      case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
      case QUOTA_EXCEEDED -> HttpStatus.FORBIDDEN;
      case PROVIDER_AUTH -> HttpStatus.BAD_GATEWAY;
      case PROVIDER_TRANSPORT -> HttpStatus.BAD_GATEWAY;
      case NOT_IMPLEMENTED -> HttpStatus.NOT_IMPLEMENTED;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}
