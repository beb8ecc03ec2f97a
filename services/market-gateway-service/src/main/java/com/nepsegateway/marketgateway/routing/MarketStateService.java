package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.client.UpstreamClient;
import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.config.MarketStateProperties;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Open/closed state of the market, held for a short TTL independent of the endpoint cache. A
 * failed check is not remembered and surfaces as an upstream error.
 */
@Service
@Slf4j
public class MarketStateService {

  private final UpstreamClient upstreamClient;
  private final MarketStateProperties properties;
  private final Clock clock;

  private volatile MarketState cached;
  private volatile Instant expiresAt = Instant.EPOCH;

  public MarketStateService(
      UpstreamClient upstreamClient, MarketStateProperties properties, Clock clock) {
    this.upstreamClient = upstreamClient;
    this.properties = properties;
    this.clock = clock;
  }

  public boolean isMarketOpen() {
    return current() == MarketState.OPEN;
  }

  public MarketState current() {
    if (cached != null && clock.instant().isBefore(expiresAt)) {
      return cached;
    }
    synchronized (this) {
      if (cached != null && clock.instant().isBefore(expiresAt)) {
        return cached;
      }
      JsonNode status = upstreamClient.fetch(UpstreamPaths.MARKET_OPEN);
      MarketState state =
          "OPEN".equals(status.path("isOpen").asText()) ? MarketState.OPEN : MarketState.CLOSED;
      if (state != cached) {
        log.info("Market state is now {}", state);
      }
      cached = state;
      expiresAt = clock.instant().plus(properties.ttl());
      return state;
    }
  }

  /** Throws when the route's precondition does not hold right now. */
  public void require(RouteDescriptor route) {
    MarketState required = route.precondition().requiredState();
    if (required != null && current() != required) {
      throw new MarketStateException(route.name(), required);
    }
  }
}
