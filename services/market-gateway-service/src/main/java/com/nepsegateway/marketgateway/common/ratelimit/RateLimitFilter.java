package com.nepsegateway.marketgateway.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.common.web.ClientAddress;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.config.WebSocketProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One admission check per HTTP request. WebSocket upgrades, tool calls and /internal/** are
 * checked by their own bindings.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

  private final SlidingWindowRateLimiter rateLimiter;
  private final GatewayErrorMapper errorMapper;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String webSocketPath;

  public RateLimitFilter(
      SlidingWindowRateLimiter rateLimiter,
      GatewayErrorMapper errorMapper,
      ObjectMapper objectMapper,
      Clock clock,
      WebSocketProperties webSocketProperties) {
    this.rateLimiter = rateLimiter;
    this.errorMapper = errorMapper;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.webSocketPath = webSocketProperties.path();
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getServletPath();
    return path == null
        || path.equals(webSocketPath)
        || path.equals("/mcp")
        || path.startsWith("/internal/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    RateLimitDecision decision =
        rateLimiter.admit(ClientAddress.resolve(request), request.getServletPath());
    RateLimitHeaders.apply(response, decision);
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");

    if (!decision.allowed()) {
      response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
      response.setHeader(
          HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds(clock.instant())));
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getOutputStream(),
          errorMapper.toResponse(new RateLimitExceededException(decision)));
      return;
    }

    filterChain.doFilter(request, response);
  }
}
