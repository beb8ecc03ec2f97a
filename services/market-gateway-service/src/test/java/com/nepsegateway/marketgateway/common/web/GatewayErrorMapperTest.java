package com.nepsegateway.marketgateway.common.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.nepsegateway.marketgateway.client.UpstreamUnavailableException;
import com.nepsegateway.marketgateway.common.ratelimit.EndpointCategory;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.routing.MarketState;
import com.nepsegateway.marketgateway.routing.MarketStateException;
import com.nepsegateway.marketgateway.routing.MissingParameterException;
import com.nepsegateway.marketgateway.routing.UnknownRouteException;
import com.nepsegateway.marketgateway.validation.ValidationFailureException;
import com.nepsegateway.marketgateway.validation.ValidationResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class GatewayErrorMapperTest {

  private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

  private final GatewayErrorMapper mapper =
      new GatewayErrorMapper(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void rateLimitRejectionCarriesQuotaDetails() {
    RateLimitDecision decision =
        new RateLimitDecision(false, 60, 0, NOW.plusMillis(12_500), EndpointCategory.MARKET_DATA);
    RateLimitExceededException error = new RateLimitExceededException(decision);

    ErrorResponse body = mapper.toResponse(error);

    assertThat(mapper.statusOf(error)).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(body.code()).isEqualTo("RATE_LIMIT_EXCEEDED");
    assertThat(body.details())
        .containsEntry("limit", 60)
        .containsEntry("remaining", 0)
        .containsEntry("resetTime", NOW.plusMillis(12_500).getEpochSecond())
        .containsEntry("retryAfterSeconds", 13L)
        .containsEntry("category", "market_data");
  }

  @Test
  void errorBodiesAreStampedWithTheInjectedClock() {
    assertThat(mapper.toResponse(new UnknownRouteException("Nope")).timestamp()).isEqualTo(NOW);
    assertThat(mapper.toResponse(new IllegalStateException("boom")).timestamp()).isEqualTo(NOW);
    assertThat(mapper.error("INVALID_JSON", "Message is not valid JSON").timestamp())
        .isEqualTo(NOW);
  }

  @Test
  void validationFailureListsSuggestions() {
    ValidationFailureException error =
        new ValidationFailureException(
            "symbol",
            ValidationResult.invalidStock(
                "NABX", "Stock symbol 'NABX' not found.", List.of("NABIL")));

    ErrorResponse body = mapper.toResponse(error);

    assertThat(mapper.statusOf(error)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(body.code()).isEqualTo("VALIDATION_FAILED");
    assertThat(body.message()).isEqualTo("Stock symbol 'NABX' not found.");
    assertThat(body.details())
        .containsEntry("parameter", "symbol")
        .containsEntry("value", "NABX")
        .containsEntry("suggestions", List.of("NABIL"))
        .doesNotContainKey("availableIndices");
  }

  @Test
  void marketStateCodeNamesTheBlockingState() {
    MarketStateException closed = new MarketStateException("LiveMarket", MarketState.OPEN);
    MarketStateException open = new MarketStateException("Floorsheet", MarketState.CLOSED);

    assertThat(mapper.statusOf(closed)).isEqualTo(HttpStatus.CONFLICT);
    assertThat(mapper.toResponse(closed).code()).isEqualTo("MARKET_CLOSED");
    assertThat(mapper.toResponse(open).code()).isEqualTo("MARKET_OPEN");
    assertThat(mapper.toResponse(open).details()).containsEntry("requiredState", "CLOSED");
  }

  @Test
  void routingErrors() {
    UnknownRouteException unknown = new UnknownRouteException("Nope");
    MissingParameterException missing = new MissingParameterException("MarketDepth", "symbol");

    assertThat(mapper.statusOf(unknown)).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(mapper.toResponse(unknown).code()).isEqualTo("ROUTE_NOT_FOUND");
    assertThat(mapper.statusOf(missing)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(mapper.toResponse(missing).details()).containsEntry("parameter", "symbol");
  }

  @Test
  void upstreamDetailIsNotLeakedToClients() {
    UpstreamUnavailableException error =
        new UpstreamUnavailableException(
            "/live-market", "Upstream error 500 for /live-market: trace");

    ErrorResponse body = mapper.toResponse(error);

    assertThat(mapper.statusOf(error)).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(body.code()).isEqualTo("UPSTREAM_UNAVAILABLE");
    assertThat(body.message()).doesNotContain("trace");
  }

  @Test
  void anythingElseIsInternal() {
    IllegalStateException error = new IllegalStateException("bug");

    assertThat(mapper.statusOf(error)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(mapper.toResponse(error).code()).isEqualTo("INTERNAL_ERROR");
    assertThat(mapper.toResponse(error).message()).isEqualTo("Unexpected error");
  }
}
