package com.nepsegateway.marketgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.websocket")
public record WebSocketProperties(String path) {

  public WebSocketProperties {
    if (path == null || path.isBlank()) {
      path = "/ws";
    }
  }
}
