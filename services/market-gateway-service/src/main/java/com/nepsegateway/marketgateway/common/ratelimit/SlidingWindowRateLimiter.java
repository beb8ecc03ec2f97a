package com.nepsegateway.marketgateway.common.ratelimit;

import com.nepsegateway.marketgateway.config.RateLimitProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory sliding-window limiter keyed by (client identity, endpoint category).
 *
 * <p>Each window holds the epoch-millis of admitted requests no older than the configured window.
 * The check-then-append for one client runs inside {@link ConcurrentMap#compute}, so two
 * concurrent requests from the same client can never both take the last slot. A rejected request
 * is not recorded.
 *
 * <p>Lives for the process lifetime; nothing is persisted.
 */
@Service
public class SlidingWindowRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

  private static final String UNKNOWN_CLIENT = "unknown";

  private final ConcurrentMap<String, ClientWindows> clients = new ConcurrentHashMap<>();
  private final RateLimitProperties properties;
  private final Clock clock;

  public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public RateLimitDecision admit(String clientId, String routeOrPath) {
    EndpointCategory category = EndpointCategory.of(routeOrPath);
    String key = clientId == null || clientId.isBlank() ? UNKNOWN_CLIENT : clientId.trim();
    int limit = properties.limitFor(category);
    long windowMillis = properties.window().toMillis();
    long now = clock.millis();

    RateLimitDecision[] result = new RateLimitDecision[1];
    clients.compute(
        key,
        (k, existing) -> {
          ClientWindows state = existing == null ? new ClientWindows() : existing;
          synchronized (state) {
            state.lastSeen = now;
            result[0] = admitInto(state, category, limit, now, windowMillis);
          }
          return state;
        });

    RateLimitDecision decision = result[0];
    if (!decision.allowed()) {
      log.warn(
          "Rate limit exceeded for client {} on {} ({}): limit {}",
          key,
          routeOrPath,
          category.wireName(),
          limit);
    }

    if (clients.size() > properties.trackedClientsThreshold()) {
      evictIdleClients(now);
    }
    return decision;
  }

  public RateLimitStats stats() {
    long now = clock.millis();
    long cutoff = now - properties.window().toMillis();
    int windows = 0;
    int active = 0;
    for (ClientWindows state : clients.values()) {
      synchronized (state) {
        for (Deque<Long> window : state.windows.values()) {
          windows++;
          for (Long t : window) {
            if (t >= cutoff) {
              active++;
            }
          }
        }
      }
    }
    Map<String, Integer> limits = new LinkedHashMap<>();
    for (EndpointCategory category : EndpointCategory.values()) {
      limits.put(category.wireName(), properties.limitFor(category));
    }
    return new RateLimitStats(
        clients.size(),
        windows,
        active,
        properties.window().toSeconds(),
        limits,
        properties.idleEviction().toSeconds());
  }

  int trackedClients() {
    return clients.size();
  }

  private void evictIdleClients(long now) {
    long cutoff = now - properties.idleEviction().toMillis();
    int before = clients.size();
    for (String key : clients.keySet()) {
      clients.computeIfPresent(key, (k, state) -> state.lastSeen < cutoff ? null : state);
    }
    log.debug("Evicted {} idle rate-limit clients", before - clients.size());
  }

  private static RateLimitDecision admitInto(
      ClientWindows state, EndpointCategory category, int limit, long now, long windowMillis) {
    Deque<Long> window = state.windows.computeIfAbsent(category, c -> new ArrayDeque<>());
    purge(window, now - windowMillis);
    if (window.size() >= limit) {
      long oldest = window.isEmpty() ? now : window.peekFirst();
      return new RateLimitDecision(
          false, limit, 0, Instant.ofEpochMilli(oldest + windowMillis), category);
    }
    window.addLast(now);
    return new RateLimitDecision(
        true,
        limit,
        Math.max(0, limit - window.size()),
        Instant.ofEpochMilli(window.peekFirst() + windowMillis),
        category);
  }

  private static void purge(Deque<Long> window, long cutoff) {
    while (!window.isEmpty() && window.peekFirst() < cutoff) {
      window.pollFirst();
    }
  }

  private static final class ClientWindows {
    private final Map<EndpointCategory, Deque<Long>> windows =
        new EnumMap<>(EndpointCategory.class);
    private volatile long lastSeen;
  }
}
