package com.nepsegateway.marketgateway.common.ratelimit;

import java.time.Duration;
import java.time.Instant;

public record RateLimitDecision(
    boolean allowed, int limit, int remaining, Instant resetAt, EndpointCategory category) {

  /** Whole seconds until the oldest counted request leaves the window; at least 1. */
  public long retryAfterSeconds(Instant now) {
    long millis = Duration.between(now, resetAt).toMillis();
    long seconds = (millis + 999) / 1000;
    return Math.max(1, seconds);
  }
}
