package com.delta.warmup.placement.provider;

import com.delta.warmup.placement.error.NotFoundException;
import com.delta.warmup.placement.error.ProviderAuthException;
import com.delta.warmup.placement.error.ProviderTransportException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.error.WarmupException;
import com.delta.warmup.placement.model.HttpFetchResult;

import java.util.Locale;

public final class ProviderErrorMapper {

  private ProviderErrorMapper() {}

  public static WarmupException fromResult(String provider, String operation, HttpFetchResult result) {
    if (result == null) {
      return new ProviderTransportException(provider, ProviderTransportException.Reason.NETWORK,
          provider + " " + operation + " returned no response");
    }
    if (result.errorCode() != null) {
      return fromErrorCode(provider, operation, result.errorCode());
    }
    return fromHttpStatus(provider, operation, result.statusCode());
  }

  public static WarmupException fromHttpStatus(String provider, String operation, int status) {
    String prefix = provider + " " + operation + " failed with HTTP " + status;
    if (status == 401 || status == 403) {
      return new ProviderAuthException(provider, provider + " rejected the API credentials (HTTP " + status + ")");
    }
    if (status == 404) {
      return new NotFoundException(provider + " " + operation + ": test not found");
    }
    if (status == 408) {
      return new ProviderTransportException(provider, ProviderTransportException.Reason.TIMEOUT, prefix);
    }
    if (status == 429) {
      return new ProviderTransportException(provider, ProviderTransportException.Reason.RATE_LIMITED, prefix);
    }
    if (status >= 500) {
      return new ProviderTransportException(provider, ProviderTransportException.Reason.SERVER_ERROR, prefix);
    }
    if (status >= 400) {
      return new ValidationException(prefix);
    }
    return new ProviderTransportException(provider, ProviderTransportException.Reason.MALFORMED_RESPONSE,
        provider + " " + operation + " returned unexpected HTTP " + status);
  }

  public static WarmupException fromErrorCode(String provider, String operation, String errorCode) {
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return new ProviderTransportException(provider, ProviderTransportException.Reason.TIMEOUT,
          provider + " " + operation + " timed out");
    }
    if (code.equals("invalid_url")) {
      return new ValidationException(provider + " base URL is invalid");
    }
    return new ProviderTransportException(provider, ProviderTransportException.Reason.NETWORK,
        provider + " " + operation + " failed: " + code);
  }

  public static ProviderTransportException malformed(String provider, String operation) {
    return new ProviderTransportException(provider, ProviderTransportException.Reason.MALFORMED_RESPONSE,
        provider + " " + operation + " returned an unreadable response");
  }
}
