package com.nepsegateway.marketgateway.common.ratelimit;

public class RateLimitExceededException extends RuntimeException {
  private final RateLimitDecision decision;

  public RateLimitExceededException(RateLimitDecision decision) {
    super(
        "Rate limit exceeded for "
            + decision.category().wireName()
            + " ("
            + decision.limit()
            + " per window)");
    this.decision = decision;
  }

  public RateLimitDecision decision() {
    return decision;
  }
}
