package com.nepsegateway.marketgateway.client;

/** The upstream data source could not be reached, answered non-2xx, or returned non-JSON. */
public class UpstreamUnavailableException extends RuntimeException {
  private final String path;

  public UpstreamUnavailableException(String path, String message) {
    super(message);
    this.path = path;
  }

  public UpstreamUnavailableException(String path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public String path() {
    return path;
  }
}
