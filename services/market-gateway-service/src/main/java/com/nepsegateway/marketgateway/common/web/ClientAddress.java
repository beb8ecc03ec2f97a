package com.nepsegateway.marketgateway.common.web;

import jakarta.servlet.http.HttpServletRequest;

/** Client identity for rate limiting: first X-Forwarded-For hop, else the socket address. */
public final class ClientAddress {

  public static final String FORWARDED_FOR = "X-Forwarded-For";

  private ClientAddress() {}

  public static String resolve(HttpServletRequest request) {
    String forwarded = request.getHeader(FORWARDED_FOR);
    if (forwarded != null && !forwarded.isBlank()) {
      String first = forwarded.split(",", 2)[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    return request.getRemoteAddr();
  }
}
