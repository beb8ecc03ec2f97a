package com.nepsegateway.marketgateway.routing;

public class MissingParameterException extends RuntimeException {
  private final String route;
  private final String parameter;

  public MissingParameterException(String route, String parameter) {
    super("Parameter '" + parameter + "' is required for " + route);
    this.route = route;
    this.parameter = parameter;
  }

  public String route() {
    return route;
  }

  public String parameter() {
    return parameter;
  }
}
