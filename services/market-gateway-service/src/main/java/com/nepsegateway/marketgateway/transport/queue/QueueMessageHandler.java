package com.nepsegateway.marketgateway.transport.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import com.nepsegateway.marketgateway.common.web.ErrorResponse;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.routing.RouteDispatcher;
import com.nepsegateway.marketgateway.routing.RouteParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One request frame in, one reply frame out. Never throws: a REP socket must answer every
 * request, including malformed ones.
 */
@Component
@Slf4j
public class QueueMessageHandler {

  static final String DEFAULT_CLIENT_ID = "zmq";

  private final RouteDispatcher dispatcher;
  private final SlidingWindowRateLimiter rateLimiter;
  private final GatewayErrorMapper errorMapper;
  private final ObjectMapper objectMapper;

  public QueueMessageHandler(
      RouteDispatcher dispatcher,
      SlidingWindowRateLimiter rateLimiter,
      GatewayErrorMapper errorMapper,
      ObjectMapper objectMapper) {
    this.dispatcher = dispatcher;
    this.rateLimiter = rateLimiter;
    this.errorMapper = errorMapper;
    this.objectMapper = objectMapper;
  }

  public String handle(String frame) {
    return serialize(reply(frame));
  }

  private Object reply(String frame) {
    JsonNode request;
    try {
      request = frame == null ? null : objectMapper.readTree(frame);
    } catch (JsonProcessingException ex) {
      return new Failure(null, errorMapper.error("INVALID_JSON", "Request is not valid JSON"));
    }
    if (request == null || !request.isObject()) {
      return new Failure(null, errorMapper.error("INVALID_JSON", "Request must be a JSON object"));
    }

    String route = request.path("route").asText(null);
    String clientId = request.path("clientId").asText(DEFAULT_CLIENT_ID);
    if (clientId.isBlank()) {
      clientId = DEFAULT_CLIENT_ID;
    }
    try {
      RateLimitDecision decision = rateLimiter.admit(clientId, route);
      if (!decision.allowed()) {
        throw new RateLimitExceededException(decision);
      }
      Object data = dispatcher.dispatch(route, RouteParams.fromJson(request.get("params")));
      return new Success(route, data);
    } catch (RuntimeException ex) {
      return new Failure(route, errorMapper.toResponse(ex));
    }
  }

  private String serialize(Object reply) {
    try {
      return objectMapper.writeValueAsString(reply);
    } catch (JsonProcessingException ex) {
      log.error("Failed to serialize queue reply", ex);
      return "{\"error\":{\"code\":\"INTERNAL_ERROR\",\"message\":\"Unexpected error\"}}";
    }
  }

  record Success(String route, Object data) {}

  record Failure(String route, ErrorResponse error) {}
}
