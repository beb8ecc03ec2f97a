package com.nepsegateway.marketgateway.routing;

public enum MarketState {
  OPEN,
  CLOSED
}
