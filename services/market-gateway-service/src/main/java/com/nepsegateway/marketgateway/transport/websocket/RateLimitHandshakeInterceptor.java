package com.nepsegateway.marketgateway.transport.websocket;

import com.nepsegateway.marketgateway.common.ratelimit.EndpointCategory;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitHeaders;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import com.nepsegateway.marketgateway.common.web.ClientAddress;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/** Admits each new connection under the websocket_connection category. */
@Component
public class RateLimitHandshakeInterceptor implements HandshakeInterceptor {

  private final SlidingWindowRateLimiter rateLimiter;
  private final Clock clock;

  public RateLimitHandshakeInterceptor(SlidingWindowRateLimiter rateLimiter, Clock clock) {
    this.rateLimiter = rateLimiter;
    this.clock = clock;
  }

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    String clientId = clientId(request);
    RateLimitDecision decision =
        rateLimiter.admit(clientId, EndpointCategory.WEBSOCKET_CONNECTION_ROUTE);
    HttpHeaders headers = response.getHeaders();
    RateLimitHeaders.apply(headers, decision);
    if (!decision.allowed()) {
      response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
      headers.set(
          HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds(clock.instant())));
      return false;
    }
    attributes.put(GatewayWebSocketHandler.CLIENT_ID_ATTRIBUTE, clientId);
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}

  private static String clientId(ServerHttpRequest request) {
    if (request instanceof ServletServerHttpRequest servletRequest) {
      return ClientAddress.resolve(servletRequest.getServletRequest());
    }
    InetSocketAddress remote = request.getRemoteAddress();
    return remote == null ? "unknown" : remote.getHostString();
  }
}
