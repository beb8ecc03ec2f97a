package com.nepsegateway.marketgateway.routing;

public enum MarketPrecondition {
  NONE(null),
  OPEN(MarketState.OPEN),
  CLOSED(MarketState.CLOSED);

  private final MarketState requiredState;

  MarketPrecondition(MarketState requiredState) {
    this.requiredState = requiredState;
  }

  /** State the market must be in, or {@code null} when the route works at any time. */
  public MarketState requiredState() {
    return requiredState;
  }
}
