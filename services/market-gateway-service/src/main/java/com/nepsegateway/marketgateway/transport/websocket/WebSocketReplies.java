package com.nepsegateway.marketgateway.transport.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.web.ErrorResponse;

/** Reply envelopes sent back over a WebSocket connection. */
final class WebSocketReplies {

  private WebSocketReplies() {}

  record Success(JsonNode messageId, Object data, RateLimitInfo rateLimit) {}

  record Failure(JsonNode messageId, ErrorResponse error) {}

  record RateLimitInfo(int limit, int remaining, long resetTime) {

    static RateLimitInfo of(RateLimitDecision decision) {
      return new RateLimitInfo(
          decision.limit(), decision.remaining(), decision.resetAt().getEpochSecond());
    }
  }
}
