package com.nepsegateway.marketgateway.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/** Error body shared by every transport. */
public record ErrorResponse(
    String code,
    String message,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details,
    Instant timestamp) {

  public static ErrorResponse of(String code, String message, Instant timestamp) {
    return new ErrorResponse(code, message, Map.of(), timestamp);
  }

  public static ErrorResponse of(
      String code, String message, Map<String, Object> details, Instant timestamp) {
    return new ErrorResponse(code, message, details, timestamp);
  }
}
