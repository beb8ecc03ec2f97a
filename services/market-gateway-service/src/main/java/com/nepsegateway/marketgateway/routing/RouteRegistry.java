package com.nepsegateway.marketgateway.routing;

import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Composite;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Parameterized;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Passthrough;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** The fixed table of logical routes, built once at startup and shared by every transport. */
@Component
public class RouteRegistry {

  public static final String SYMBOL = "symbol";
  public static final String MARKET_OVERVIEW = "TradeTurnoverTransactionSubindices";

  private final Map<String, RouteDescriptor> byName;

  public RouteRegistry(MarketOverviewAggregator aggregator) {
    List<RouteDescriptor> defs = new ArrayList<>();
    defs.add(
        new Passthrough(
            "Summary",
            UpstreamPaths.MARKET_SUMMARY,
            PayloadTransforms.detailToValue(),
            MarketPrecondition.NONE));
    defs.add(
        new Passthrough(
            "NepseIndex",
            UpstreamPaths.NEPSE_INDEX,
            PayloadTransforms.keyedBy("index"),
            MarketPrecondition.NONE));
    defs.add(
        new Passthrough(
            "NepseSubIndices",
            UpstreamPaths.NEPSE_SUBINDICES,
            PayloadTransforms.keyedBy("index"),
            MarketPrecondition.NONE));
    defs.add(plain("LiveMarket", UpstreamPaths.LIVE_MARKET, MarketPrecondition.OPEN));
    defs.add(plain("SupplyDemand", UpstreamPaths.SUPPLY_DEMAND, MarketPrecondition.OPEN));
    defs.add(plain("PriceVolume", UpstreamPaths.PRICE_VOLUME, MarketPrecondition.NONE));
    defs.add(plain("TopGainers", UpstreamPaths.TOP_GAINERS, MarketPrecondition.NONE));
    defs.add(plain("TopLosers", UpstreamPaths.TOP_LOSERS, MarketPrecondition.NONE));
    defs.add(plain("TopTenTradeScrips", UpstreamPaths.TOP_TRADE, MarketPrecondition.NONE));
    defs.add(plain("TopTenTurnoverScrips", UpstreamPaths.TOP_TURNOVER, MarketPrecondition.NONE));
    defs.add(
        plain("TopTenTransactionScrips", UpstreamPaths.TOP_TRANSACTION, MarketPrecondition.NONE));
    defs.add(plain("IsNepseOpen", UpstreamPaths.MARKET_OPEN, MarketPrecondition.NONE));
    defs.add(plain("CompanyList", UpstreamPaths.COMPANY_LIST, MarketPrecondition.NONE));
    defs.add(plain("SectorScrips", UpstreamPaths.SECTOR_SCRIPS, MarketPrecondition.NONE));
    defs.add(plain("SecurityList", UpstreamPaths.SECURITY_LIST, MarketPrecondition.NONE));
    defs.add(plain("Floorsheet", UpstreamPaths.FLOORSHEET, MarketPrecondition.CLOSED));

    indexGraph(defs, "DailyNepseIndexGraph", "nepse");
    indexGraph(defs, "DailySensitiveIndexGraph", "sensitive");
    indexGraph(defs, "DailyFloatIndexGraph", "float");
    indexGraph(defs, "DailySensitiveFloatIndexGraph", "sensitive-float");
    indexGraph(defs, "DailyBankSubindexGraph", "bank");
    indexGraph(defs, "DailyDevelopmentBankSubindexGraph", "development-bank");
    indexGraph(defs, "DailyFinanceSubindexGraph", "finance");
    indexGraph(defs, "DailyHotelTourismSubindexGraph", "hotel-tourism");
    indexGraph(defs, "DailyHydroPowerSubindexGraph", "hydropower");
    indexGraph(defs, "DailyInvestmentSubindexGraph", "investment");
    indexGraph(defs, "DailyLifeInsuranceSubindexGraph", "life-insurance");
    indexGraph(defs, "DailyManufacturingProcessingSubindexGraph", "manufacturing-processing");
    indexGraph(defs, "DailyMicrofinanceSubindexGraph", "microfinance");
    indexGraph(defs, "DailyMutualFundSubindexGraph", "mutual-fund");
    indexGraph(defs, "DailyNonLifeInsuranceSubindexGraph", "non-life-insurance");
    indexGraph(defs, "DailyOthersSubindexGraph", "others");
    indexGraph(defs, "DailyTradingSubindexGraph", "trading");

    defs.add(
        bySymbol(
            "DailyScripPriceGraph", UpstreamPaths.SCRIP_PRICE_GRAPH, MarketPrecondition.NONE));
    defs.add(bySymbol("CompanyDetails", UpstreamPaths.COMPANY_DETAILS, MarketPrecondition.NONE));
    defs.add(
        bySymbol(
            "PriceVolumeHistory", UpstreamPaths.PRICE_VOLUME_HISTORY, MarketPrecondition.NONE));
    defs.add(bySymbol("MarketDepth", UpstreamPaths.MARKET_DEPTH, MarketPrecondition.OPEN));
    defs.add(bySymbol("FloorsheetOf", UpstreamPaths.FLOORSHEET_OF, MarketPrecondition.CLOSED));

    defs.add(
        new Composite(MARKET_OVERVIEW, aggregator::buildMarketOverview, MarketPrecondition.NONE));

    Map<String, RouteDescriptor> map = new LinkedHashMap<>();
    for (RouteDescriptor def : defs) {
      if (map.putIfAbsent(def.name(), def) != null) {
        throw new IllegalStateException("Duplicate route " + def.name());
      }
    }
    this.byName = Collections.unmodifiableMap(map);
  }

  public Optional<RouteDescriptor> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byName.get(name));
  }

  public List<RouteDescriptor> all() {
    return List.copyOf(byName.values());
  }

  private static Passthrough plain(String name, String path, MarketPrecondition precondition) {
    return new Passthrough(name, path, PayloadTransforms.identity(), precondition);
  }

  private static Parameterized bySymbol(
      String name, String pathTemplate, MarketPrecondition precondition) {
    return new Parameterized(name, pathTemplate, List.of(SYMBOL), precondition);
  }

  private static void indexGraph(List<RouteDescriptor> defs, String name, String slug) {
    defs.add(plain(name, UpstreamPaths.indexGraph(slug), MarketPrecondition.NONE));
  }
}
