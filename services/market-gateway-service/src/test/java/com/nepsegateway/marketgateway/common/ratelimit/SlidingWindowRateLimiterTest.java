package com.nepsegateway.marketgateway.common.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.nepsegateway.marketgateway.config.RateLimitProperties;
import com.nepsegateway.marketgateway.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {

  private static final Instant START = Instant.parse("2024-05-01T09:00:00Z");

  private MutableClock clock;
  private SlidingWindowRateLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    limiter = new SlidingWindowRateLimiter(RateLimitProperties.defaults(), clock);
  }

  @Test
  void rejectsRequestAfterLimitAndAdmitsAgainOnceWindowPasses() {
    for (int i = 0; i < 50; i++) {
      assertThat(limiter.admit("10.0.0.1", "/health").allowed()).isTrue();
      clock.advance(Duration.ofMillis(100));
    }

    RateLimitDecision rejected = limiter.admit("10.0.0.1", "/health");
    assertThat(rejected.allowed()).isFalse();
    assertThat(rejected.remaining()).isZero();
    assertThat(rejected.category()).isEqualTo(EndpointCategory.HEALTH);
    assertThat(rejected.resetAt()).isEqualTo(START.plus(Duration.ofMinutes(1)));

    clock.advance(Duration.ofMinutes(1));
    assertThat(limiter.admit("10.0.0.1", "/health").allowed()).isTrue();
  }

  @Test
  void remainingCountsDownFromTheCategoryLimit() {
    RateLimitDecision first = limiter.admit("10.0.0.1", "/Summary");
    RateLimitDecision second = limiter.admit("10.0.0.1", "Summary");

    assertThat(first.limit()).isEqualTo(60);
    assertThat(first.remaining()).isEqualTo(59);
    assertThat(second.remaining()).isEqualTo(58);
    assertThat(second.category()).isEqualTo(EndpointCategory.MARKET_DATA);
  }

  @Test
  void rejectedRequestsAreNotRecorded() {
    RateLimitProperties props =
        new RateLimitProperties(null, null, null, Map.of("default", 2));
    limiter = new SlidingWindowRateLimiter(props, clock);

    limiter.admit("c", "/anything");
    clock.advance(Duration.ofSeconds(30));
    limiter.admit("c", "/anything");
    for (int i = 0; i < 5; i++) {
      assertThat(limiter.admit("c", "/anything").allowed()).isFalse();
    }

    // Only the first request leaves the window; the rejected ones never entered it.
    clock.advance(Duration.ofSeconds(30).plusMillis(1));
    assertThat(limiter.admit("c", "/anything").allowed()).isTrue();
    assertThat(limiter.admit("c", "/anything").allowed()).isFalse();
  }

  @Test
  void clientsAndCategoriesHaveIndependentWindows() {
    RateLimitProperties props =
        new RateLimitProperties(null, null, null, Map.of("health", 1, "validation", 1));
    limiter = new SlidingWindowRateLimiter(props, clock);

    assertThat(limiter.admit("a", "/health").allowed()).isTrue();
    assertThat(limiter.admit("a", "/health").allowed()).isFalse();
    assertThat(limiter.admit("a", "/validate/stock/NABIL").allowed()).isTrue();
    assertThat(limiter.admit("b", "/health").allowed()).isTrue();
  }

  @Test
  void blankClientIsTrackedAsUnknown() {
    limiter.admit(null, "/health");
    limiter.admit("  ", "/health");

    assertThat(limiter.trackedClients()).isEqualTo(1);
    assertThat(limiter.stats().activeRequestsInWindow()).isEqualTo(2);
  }

  @Test
  void evictsIdleClientsOnceThresholdIsExceeded() {
    RateLimitProperties props =
        new RateLimitProperties(Duration.ofMinutes(1), Duration.ofMinutes(5), 2, null);
    limiter = new SlidingWindowRateLimiter(props, clock);

    limiter.admit("a", "/health");
    limiter.admit("b", "/health");
    clock.advance(Duration.ofMinutes(6));
    limiter.admit("c", "/health");

    assertThat(limiter.trackedClients()).isEqualTo(1);
  }

  @Test
  void statsReportWindowsAndConfiguredLimits() {
    limiter.admit("a", "/health");
    limiter.admit("a", "/Summary");
    limiter.admit("b", "/health");

    RateLimitStats stats = limiter.stats();

    assertThat(stats.totalTrackedClients()).isEqualTo(2);
    assertThat(stats.totalTrackedWindows()).isEqualTo(3);
    assertThat(stats.activeRequestsInWindow()).isEqualTo(3);
    assertThat(stats.windowSizeSeconds()).isEqualTo(60);
    assertThat(stats.idleEvictionSeconds()).isEqualTo(300);
    assertThat(stats.limits())
        .containsEntry("health", 50)
        .containsEntry("validation", 120)
        .containsEntry("market_data", 60)
        .containsEntry("websocket_connection", 100)
        .containsEntry("websocket_message", 50)
        .containsEntry("default", 60);
  }

  @Test
  void concurrentRequestsNeverExceedTheLimit() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger admitted = new AtomicInteger();
    try {
      for (int t = 0; t < 8; t++) {
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 50; i++) {
                if (limiter.admit("shared", "/Summary").allowed()) {
                  admitted.incrementAndGet();
                }
              }
              return null;
            });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(admitted.get()).isEqualTo(60);
  }
}
