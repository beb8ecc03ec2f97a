package com.nepsegateway.marketgateway.config;

import com.nepsegateway.marketgateway.common.ratelimit.EndpointCategory;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sliding-window limits per endpoint category.
 *
 * <p>{@code limits} is keyed by {@link EndpointCategory#configKey()} (e.g. {@code market-data});
 * any category left out of the configuration falls back to its built-in default.
 */
@ConfigurationProperties(prefix = "gateway.rate-limit")
public record RateLimitProperties(
    Duration window,
    Duration idleEviction,
    Integer trackedClientsThreshold,
    Map<String, Integer> limits) {

  public RateLimitProperties {
    if (window == null) {
      window = Duration.ofMinutes(1);
    }
    if (idleEviction == null) {
      idleEviction = Duration.ofMinutes(5);
    }
    if (trackedClientsThreshold == null || trackedClientsThreshold <= 0) {
      trackedClientsThreshold = 1000;
    }
    Map<String, Integer> merged = new HashMap<>();
    for (EndpointCategory category : EndpointCategory.values()) {
      merged.put(category.configKey(), category.defaultLimit());
    }
    if (limits != null) {
      merged.putAll(limits);
    }
    limits = Map.copyOf(merged);
  }

  public static RateLimitProperties defaults() {
    return new RateLimitProperties(null, null, null, null);
  }

  public int limitFor(EndpointCategory category) {
    Integer limit = limits.get(category.configKey());
    return limit == null ? category.defaultLimit() : limit;
  }
}
