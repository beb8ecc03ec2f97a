package com.nepsegateway.marketgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the upstream exchange data source.
 *
 * <p>{@code timeout} bounds live-path requests; {@code batchTimeout} is the longer budget used by
 * the snapshot updater.
 */
@ConfigurationProperties(prefix = "gateway.upstream")
public record UpstreamProperties(String baseUrl, Duration timeout, Duration batchTimeout) {

  public UpstreamProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "http://localhost:8000";
    }
    if (timeout == null) {
      timeout = Duration.ofSeconds(10);
    }
    if (batchTimeout == null || batchTimeout.compareTo(Duration.ofSeconds(30)) < 0) {
      batchTimeout = Duration.ofSeconds(30);
    }
  }
}
