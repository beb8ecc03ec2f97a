package com.nepsegateway.marketgateway.config;

import com.nepsegateway.marketgateway.transport.websocket.GatewayWebSocketHandler;
import com.nepsegateway.marketgateway.transport.websocket.RateLimitHandshakeInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.ServletWebSocketHandlerRegistry;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final GatewayWebSocketHandler handler;
  private final RateLimitHandshakeInterceptor handshakeInterceptor;
  private final WebSocketProperties properties;

  public WebSocketConfig(
      GatewayWebSocketHandler handler,
      RateLimitHandshakeInterceptor handshakeInterceptor,
      WebSocketProperties properties) {
    this.handler = handler;
    this.handshakeInterceptor = handshakeInterceptor;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    // Ahead of the GET /{route} catch-all, which would otherwise claim the upgrade request.
    if (registry instanceof ServletWebSocketHandlerRegistry servletRegistry) {
      servletRegistry.setOrder(Ordered.HIGHEST_PRECEDENCE);
    }
    registry
        .addHandler(handler, properties.path())
        .addInterceptors(handshakeInterceptor)
        .setAllowedOrigins("*");
  }
}
