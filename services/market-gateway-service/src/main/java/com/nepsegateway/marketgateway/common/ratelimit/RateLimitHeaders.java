package com.nepsegateway.marketgateway.common.ratelimit;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

public final class RateLimitHeaders {

  public static final String LIMIT = "X-RateLimit-Limit";
  public static final String REMAINING = "X-RateLimit-Remaining";
  public static final String RESET = "X-RateLimit-Reset";
  public static final String CATEGORY = "X-RateLimit-Category";

  private RateLimitHeaders() {}

  public static void apply(HttpServletResponse response, RateLimitDecision decision) {
    response.setHeader(LIMIT, String.valueOf(decision.limit()));
    response.setHeader(REMAINING, String.valueOf(decision.remaining()));
    response.setHeader(RESET, String.valueOf(decision.resetAt().getEpochSecond()));
    response.setHeader(CATEGORY, decision.category().wireName());
  }

  public static void apply(HttpHeaders headers, RateLimitDecision decision) {
    headers.set(LIMIT, String.valueOf(decision.limit()));
    headers.set(REMAINING, String.valueOf(decision.remaining()));
    headers.set(RESET, String.valueOf(decision.resetAt().getEpochSecond()));
    headers.set(CATEGORY, decision.category().wireName());
  }
}
