package com.nepsegateway.marketgateway.validation;

public record CompanyMatch(String symbol, String companyName, String sector, MatchType matchType) {

  public enum MatchType {
    EXACT,
    PARTIAL
  }
}
