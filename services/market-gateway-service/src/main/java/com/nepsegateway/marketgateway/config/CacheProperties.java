package com.nepsegateway.marketgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.cache")
public record CacheProperties(Duration ttl, Long maximumSize) {

  public CacheProperties {
    if (ttl == null) {
      ttl = Duration.ofMinutes(10);
    }
    if (maximumSize == null || maximumSize <= 0) {
      maximumSize = 1000L;
    }
  }
}
