package com.nepsegateway.marketgateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.nepsegateway.marketgateway.config.CacheProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Path-keyed, write-expiring memo in front of {@link UpstreamClient}.
 *
 * <p>An expired entry is a miss, never a stale hit. A failed upstream call leaves no entry behind,
 * so the next caller retries. Concurrent misses on the same path share one upstream call: Caffeine
 * runs the loader at most once per key at a time and the other callers wait for its result.
 */
@Component
public class EndpointResponseCache {

  private final UpstreamClient upstreamClient;
  private final Cache<String, JsonNode> cache;

  @Autowired
  public EndpointResponseCache(UpstreamClient upstreamClient, CacheProperties properties) {
    this(upstreamClient, properties, Ticker.systemTicker());
  }

  EndpointResponseCache(UpstreamClient upstreamClient, CacheProperties properties, Ticker ticker) {
    this.upstreamClient = upstreamClient;
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.ttl())
            .maximumSize(properties.maximumSize())
            .ticker(ticker)
            .build();
  }

  public JsonNode fetch(String path) {
    return cache.get(path, upstreamClient::fetch);
  }

  public void invalidate(String path) {
    cache.invalidate(path);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
