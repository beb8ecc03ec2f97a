package com.nepsegateway.marketgateway.routing;

/** The route only works while the market is {@code required}, and it is currently not. */
public class MarketStateException extends RuntimeException {
  private final String route;
  private final MarketState required;

  public MarketStateException(String route, MarketState required) {
    super(
        required == MarketState.OPEN
            ? "Market is closed. " + route + " only works while the market is open."
            : "Market is open. " + route + " only works after the market has closed.");
    this.route = route;
    this.required = required;
  }

  public String route() {
    return route;
  }

  public MarketState required() {
    return required;
  }
}
