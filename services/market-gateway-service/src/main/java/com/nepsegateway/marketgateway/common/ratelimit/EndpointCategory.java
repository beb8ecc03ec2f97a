package com.nepsegateway.marketgateway.common.ratelimit;

import java.util.Set;

/** Rate-limit bucket a request falls into, derived from its route name or HTTP path. */
public enum EndpointCategory {
  HEALTH("health", "health", 50),
  VALIDATION("validation", "validation", 120),
  MARKET_DATA("market_data", "market-data", 60),
  WEBSOCKET_CONNECTION("websocket_connection", "websocket-connection", 100),
  WEBSOCKET_MESSAGE("websocket_message", "websocket-message", 50),
  DEFAULT("default", "default", 60);

  public static final String WEBSOCKET_CONNECTION_ROUTE = "websocket_connection";
  public static final String WEBSOCKET_MESSAGE_ROUTE = "websocket_message";

  private static final Set<String> MARKET_DATA_PATHS =
      Set.of("/Summary", "/LiveMarket", "/PriceVolume", "/TopGainers", "/TopLosers");

  private final String wireName;
  private final String configKey;
  private final int defaultLimit;

  EndpointCategory(String wireName, String configKey, int defaultLimit) {
    this.wireName = wireName;
    this.configKey = configKey;
    this.defaultLimit = defaultLimit;
  }

  /** Name used in response headers and stats payloads. */
  public String wireName() {
    return wireName;
  }

  /** Key under {@code gateway.rate-limit.limits}. */
  public String configKey() {
    return configKey;
  }

  public int defaultLimit() {
    return defaultLimit;
  }

  /**
   * Accepts either an HTTP path ({@code /Summary?x=1}) or a bare route name ({@code Summary}).
   * Anything unrecognised, including null, is {@link #DEFAULT}.
   */
  public static EndpointCategory of(String routeOrPath) {
    if (routeOrPath == null) {
      return DEFAULT;
    }
    String value = routeOrPath.trim();
    int query = value.indexOf('?');
    if (query >= 0) {
      value = value.substring(0, query);
    }
    if (value.isEmpty()) {
      return DEFAULT;
    }
    if (WEBSOCKET_CONNECTION_ROUTE.equals(value)) {
      return WEBSOCKET_CONNECTION;
    }
    if (WEBSOCKET_MESSAGE_ROUTE.equals(value)) {
      return WEBSOCKET_MESSAGE;
    }
    String path = value.startsWith("/") ? value : "/" + value;
    if ("/health".equals(path)) {
      return HEALTH;
    }
    if (path.startsWith("/validate")) {
      return VALIDATION;
    }
    if (MARKET_DATA_PATHS.contains(path)) {
      return MARKET_DATA;
    }
    return DEFAULT;
  }
}
