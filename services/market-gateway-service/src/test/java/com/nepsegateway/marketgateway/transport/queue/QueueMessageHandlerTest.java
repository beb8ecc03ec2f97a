package com.nepsegateway.marketgateway.transport.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.config.RateLimitProperties;
import com.nepsegateway.marketgateway.routing.MarketState;
import com.nepsegateway.marketgateway.routing.MarketStateException;
import com.nepsegateway.marketgateway.routing.RouteDispatcher;
import com.nepsegateway.marketgateway.support.MutableClock;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueMessageHandlerTest {

  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

  private RouteDispatcher dispatcher;
  private QueueMessageHandler handler;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    dispatcher = mock(RouteDispatcher.class);
    RateLimitProperties limits =
        new RateLimitProperties(null, null, null, Map.of("market-data", 2));
    handler =
        new QueueMessageHandler(
            dispatcher,
            new SlidingWindowRateLimiter(limits, clock),
            new GatewayErrorMapper(clock),
            objectMapper);
  }

  @Test
  void dispatchesRouteWithParams() throws Exception {
    when(dispatcher.dispatch(eq("CompanyDetails"), eq(Map.of("symbol", "NABIL"))))
        .thenReturn(Map.of("symbol", "NABIL"));

    JsonNode reply =
        reply("{\"route\":\"CompanyDetails\",\"params\":{\"symbol\":\"NABIL\"}}");

    assertThat(reply.get("route").asText()).isEqualTo("CompanyDetails");
    assertThat(reply.at("/data/symbol").asText()).isEqualTo("NABIL");
    assertThat(reply.has("error")).isFalse();
  }

  @Test
  void malformedFrameGetsErrorReply() throws Exception {
    JsonNode reply = reply("not json");

    assertThat(reply.at("/error/code").asText()).isEqualTo("INVALID_JSON");
    verify(dispatcher, never()).dispatch(any(), any());
  }

  @Test
  void nonObjectFrameGetsErrorReply() throws Exception {
    assertThat(reply("[1,2]").at("/error/code").asText()).isEqualTo("INVALID_JSON");
  }

  @Test
  void dispatchFailureIsMappedToErrorBody() throws Exception {
    when(dispatcher.dispatch(eq("LiveMarket"), any()))
        .thenThrow(new MarketStateException("LiveMarket", MarketState.OPEN));

    JsonNode reply = reply("{\"route\":\"LiveMarket\"}");

    assertThat(reply.get("route").asText()).isEqualTo("LiveMarket");
    assertThat(reply.at("/error/code").asText()).isEqualTo("MARKET_CLOSED");
  }

  @Test
  void requestsAreRateLimitedPerClientId() throws Exception {
    when(dispatcher.dispatch(eq("TopGainers"), any())).thenReturn(Map.of());

    reply("{\"route\":\"TopGainers\",\"clientId\":\"bot-1\"}");
    reply("{\"route\":\"TopGainers\",\"clientId\":\"bot-1\"}");
    JsonNode rejected = reply("{\"route\":\"TopGainers\",\"clientId\":\"bot-1\"}");
    JsonNode otherClient = reply("{\"route\":\"TopGainers\",\"clientId\":\"bot-2\"}");

    assertThat(rejected.at("/error/code").asText()).isEqualTo("RATE_LIMIT_EXCEEDED");
    assertThat(rejected.at("/error/details/limit").asInt()).isEqualTo(2);
    assertThat(otherClient.has("error")).isFalse();
  }

  private JsonNode reply(String frame) throws Exception {
    return objectMapper.readTree(handler.handle(frame));
  }
}
