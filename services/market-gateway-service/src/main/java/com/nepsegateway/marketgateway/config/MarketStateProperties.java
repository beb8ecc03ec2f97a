package com.nepsegateway.marketgateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.market-state")
public record MarketStateProperties(Duration ttl) {

  public MarketStateProperties {
    if (ttl == null) {
      ttl = Duration.ofSeconds(30);
    }
  }
}
