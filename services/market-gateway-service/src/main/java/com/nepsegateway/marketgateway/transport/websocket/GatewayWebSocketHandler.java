package com.nepsegateway.marketgateway.transport.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.common.ratelimit.EndpointCategory;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.routing.RouteDispatcher;
import com.nepsegateway.marketgateway.routing.RouteParams;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket binding of the route table. Messages are {@code {route, params, messageId}}; every
 * message gets exactly one reply and no failure closes the connection.
 */
@Component
@Slf4j
public class GatewayWebSocketHandler extends TextWebSocketHandler {

  static final String CLIENT_ID_ATTRIBUTE = "clientId";

  private final RouteDispatcher dispatcher;
  private final SlidingWindowRateLimiter rateLimiter;
  private final GatewayErrorMapper errorMapper;
  private final ObjectMapper objectMapper;

  public GatewayWebSocketHandler(
      RouteDispatcher dispatcher,
      SlidingWindowRateLimiter rateLimiter,
      GatewayErrorMapper errorMapper,
      ObjectMapper objectMapper) {
    this.dispatcher = dispatcher;
    this.rateLimiter = rateLimiter;
    this.errorMapper = errorMapper;
    this.objectMapper = objectMapper;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    log.info("WebSocket connected: {} from {}", session.getId(), clientId(session));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws IOException {
    RateLimitDecision decision =
        rateLimiter.admit(clientId(session), EndpointCategory.WEBSOCKET_MESSAGE_ROUTE);
    if (!decision.allowed()) {
      // Checked before parsing, so the messageId is not known yet.
      send(
          session,
          new WebSocketReplies.Failure(
              null, errorMapper.toResponse(new RateLimitExceededException(decision))));
      return;
    }

    JsonNode request;
    try {
      request = objectMapper.readTree(message.getPayload());
    } catch (JsonProcessingException ex) {
      send(session, invalidJson("Message is not valid JSON"));
      return;
    }
    if (request == null || !request.isObject()) {
      send(session, invalidJson("Message must be a JSON object"));
      return;
    }

    JsonNode messageId = request.get("messageId");
    String route = request.path("route").asText(null);
    try {
      Object data = dispatcher.dispatch(route, RouteParams.fromJson(request.get("params")));
      send(
          session,
          new WebSocketReplies.Success(
              messageId, data, WebSocketReplies.RateLimitInfo.of(decision)));
    } catch (RuntimeException ex) {
      send(session, new WebSocketReplies.Failure(messageId, errorMapper.toResponse(ex)));
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    log.info("WebSocket disconnected: {} ({})", session.getId(), status);
  }

  private WebSocketReplies.Failure invalidJson(String message) {
    return new WebSocketReplies.Failure(null, errorMapper.error("INVALID_JSON", message));
  }

  private static String clientId(WebSocketSession session) {
    Object clientId = session.getAttributes().get(CLIENT_ID_ATTRIBUTE);
    return clientId == null ? "unknown" : clientId.toString();
  }

  private void send(WebSocketSession session, Object reply) throws IOException {
    if (session.isOpen()) {
      session.sendMessage(new TextMessage(objectMapper.writeValueAsString(reply)));
    }
  }
}
