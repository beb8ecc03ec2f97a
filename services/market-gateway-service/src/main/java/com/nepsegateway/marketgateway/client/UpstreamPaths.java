package com.nepsegateway.marketgateway.client;

/** Paths on the upstream market data API, relative to {@code gateway.upstream.base-url}. */
public final class UpstreamPaths {

  public static final String HEALTH = "/health";
  public static final String MARKET_SUMMARY = "/market-summary";
  public static final String LIVE_MARKET = "/live-market";
  public static final String PRICE_VOLUME = "/price-volume";
  public static final String SUPPLY_DEMAND = "/supply-demand";
  public static final String TOP_GAINERS = "/top-gainers";
  public static final String TOP_LOSERS = "/top-losers";
  public static final String TOP_TRADE = "/top-trade";
  public static final String TOP_TURNOVER = "/top-turnover";
  public static final String TOP_TRANSACTION = "/top-transaction";
  public static final String MARKET_OPEN = "/market-open";
  public static final String NEPSE_INDEX = "/nepse-index";
  public static final String NEPSE_SUBINDICES = "/nepse-subindices";
  public static final String COMPANY_LIST = "/company-list";
  public static final String SECTOR_SCRIPS = "/sector-scrips";
  public static final String SECURITY_LIST = "/security-list";
  public static final String FLOORSHEET = "/floorsheet";

  public static final String SCRIP_PRICE_GRAPH = "/graph/scrip/{symbol}";
  public static final String MARKET_DEPTH = "/market-depth/{symbol}";
  public static final String COMPANY_DETAILS = "/company-details/{symbol}";
  public static final String FLOORSHEET_OF = "/floorsheet/{symbol}";
  public static final String PRICE_VOLUME_HISTORY = "/price-volume-history/{symbol}";

  private UpstreamPaths() {}

  public static String indexGraph(String indexSlug) {
    return "/graph/index/" + indexSlug;
  }
}
