package com.nepsegateway.marketgateway.internal;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Guards /internal/** with the shared X-Internal-Token header. */
@Component
@Slf4j
public class InternalApiAuthFilter extends OncePerRequestFilter {

  static final String TOKEN_HEADER = "X-Internal-Token";

  private final String expectedToken;

  public InternalApiAuthFilter(@Value("${internal.auth.token:}") String expectedToken) {
    this.expectedToken = expectedToken == null ? "" : expectedToken.trim();
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getServletPath();
    return path == null || !path.startsWith("/internal/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (expectedToken.isBlank()) {
      log.error("internal.auth.token is not configured; rejecting {}", request.getRequestURI());
      reject(
          response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "INTERNAL_TOKEN_NOT_CONFIGURED");
      return;
    }

    String provided = request.getHeader(TOKEN_HEADER);
    if (provided == null || !matches(provided)) {
      log.warn("Internal token mismatch for {} {}", request.getMethod(), request.getRequestURI());
      reject(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private boolean matches(String provided) {
    return MessageDigest.isEqual(
        expectedToken.getBytes(StandardCharsets.UTF_8),
        provided.trim().getBytes(StandardCharsets.UTF_8));
  }

  private static void reject(HttpServletResponse response, int status, String code)
      throws IOException {
    response.setStatus(status);
    response.setContentType("application/json");
    response.getWriter().write("{\"code\":\"" + code + "\"}");
  }
}
