package com.nepsegateway.marketgateway.dto;

public record HealthResponse(String status) {

  public static HealthResponse healthy() {
    return new HealthResponse("healthy");
  }
}
