package com.nepsegateway.marketgateway.routing;

public class UnknownRouteException extends RuntimeException {
  private final String route;

  public UnknownRouteException(String route) {
    super("Route not found: " + route);
    this.route = route;
  }

  public String route() {
    return route;
  }
}
