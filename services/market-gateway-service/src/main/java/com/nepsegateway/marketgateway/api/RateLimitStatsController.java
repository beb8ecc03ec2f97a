package com.nepsegateway.marketgateway.api;

import com.nepsegateway.marketgateway.common.ratelimit.RateLimitStats;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RateLimitStatsController {

  private final SlidingWindowRateLimiter rateLimiter;

  public RateLimitStatsController(SlidingWindowRateLimiter rateLimiter) {
    this.rateLimiter = rateLimiter;
  }

  @GetMapping("/rate-limit/stats")
  public ResponseEntity<RateLimitStats> stats() {
    return CachedResponses.ok(rateLimiter.stats());
  }
}
