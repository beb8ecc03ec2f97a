package com.nepsegateway.marketgateway.common.web;

import com.nepsegateway.marketgateway.client.UpstreamUnavailableException;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.routing.MarketState;
import com.nepsegateway.marketgateway.routing.MarketStateException;
import com.nepsegateway.marketgateway.routing.MissingParameterException;
import com.nepsegateway.marketgateway.routing.UnknownRouteException;
import com.nepsegateway.marketgateway.validation.ValidationFailureException;
import com.nepsegateway.marketgateway.validation.ValidationResult;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Single translation from gateway exceptions to status + {@link ErrorResponse}. HTTP uses the
 * status; WebSocket, queue and tool-call bindings only use the body.
 */
@Component
@Slf4j
public class GatewayErrorMapper {

  private final Clock clock;

  public GatewayErrorMapper(Clock clock) {
    this.clock = clock;
  }

  public HttpStatus statusOf(Throwable error) {
    if (error instanceof RateLimitExceededException) {
      return HttpStatus.TOO_MANY_REQUESTS;
    }
    if (error instanceof ValidationFailureException || error instanceof MissingParameterException) {
      return HttpStatus.BAD_REQUEST;
    }
    if (error instanceof UnknownRouteException) {
      return HttpStatus.NOT_FOUND;
    }
    if (error instanceof MarketStateException) {
      return HttpStatus.CONFLICT;
    }
    if (error instanceof UpstreamUnavailableException) {
      return HttpStatus.BAD_GATEWAY;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  public ErrorResponse toResponse(Throwable error) {
    if (error instanceof RateLimitExceededException rate) {
      return error("RATE_LIMIT_EXCEEDED", rate.getMessage(), rateLimitDetails(rate));
    }
    if (error instanceof ValidationFailureException invalid) {
      return error(
          "VALIDATION_FAILED", invalid.getMessage(), validationDetails(invalid));
    }
    if (error instanceof MissingParameterException missing) {
      return error(
          "MISSING_PARAMETER",
          missing.getMessage(),
          Map.of("route", missing.route(), "parameter", missing.parameter()));
    }
    if (error instanceof UnknownRouteException unknown) {
      return error(
          "ROUTE_NOT_FOUND",
          unknown.getMessage(),
          Map.of("route", String.valueOf(unknown.route())));
    }
    if (error instanceof MarketStateException marketState) {
      String code =
          marketState.required() == MarketState.OPEN ? "MARKET_CLOSED" : "MARKET_OPEN";
      return error(
          code,
          marketState.getMessage(),
          Map.of("route", marketState.route(), "requiredState", marketState.required().name()));
    }
    if (error instanceof UpstreamUnavailableException upstream) {
      log.error("Upstream unavailable: {}", upstream.getMessage());
      return error("UPSTREAM_UNAVAILABLE", "Upstream data source is unavailable");
    }
    log.error("Unhandled exception", error);
    return error("INTERNAL_ERROR", "Unexpected error");
  }

  /** Error body stamped with this mapper's clock. */
  public ErrorResponse error(String code, String message) {
    return ErrorResponse.of(code, message, clock.instant());
  }

  private ErrorResponse error(String code, String message, Map<String, Object> details) {
    return ErrorResponse.of(code, message, details, clock.instant());
  }

  private Map<String, Object> rateLimitDetails(RateLimitExceededException rate) {
    RateLimitDecision decision = rate.decision();
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("limit", decision.limit());
    details.put("remaining", decision.remaining());
    details.put("resetTime", decision.resetAt().getEpochSecond());
    details.put("retryAfterSeconds", decision.retryAfterSeconds(clock.instant()));
    details.put("category", decision.category().wireName());
    return details;
  }

  private static Map<String, Object> validationDetails(ValidationFailureException invalid) {
    ValidationResult result = invalid.result();
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("parameter", invalid.parameter());
    if (result.canonicalValue() != null) {
      details.put("value", result.canonicalValue());
    }
    if (result.suggestions() != null) {
      details.put("suggestions", result.suggestions());
    }
    if (result.availableIndices() != null) {
      details.put("availableIndices", result.availableIndices());
    }
    return details;
  }
}
