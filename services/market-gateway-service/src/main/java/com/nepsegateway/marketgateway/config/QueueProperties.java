package com.nepsegateway.marketgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** ZeroMQ request/reply binding. Disabled unless {@code gateway.queue.enabled=true}. */
@ConfigurationProperties(prefix = "gateway.queue")
public record QueueProperties(boolean enabled, String bindAddress, Duration receiveTimeout) {

  public QueueProperties {
    if (bindAddress == null || bindAddress.isBlank()) {
      bindAddress = "tcp://*:5556";
    }
    if (receiveTimeout == null) {
      receiveTimeout = Duration.ofSeconds(1);
    }
  }
}
