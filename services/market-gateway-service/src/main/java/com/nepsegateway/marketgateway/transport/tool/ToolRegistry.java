package com.nepsegateway.marketgateway.transport.tool;

import com.nepsegateway.marketgateway.routing.MissingParameterException;
import com.nepsegateway.marketgateway.routing.RouteDispatcher;
import com.nepsegateway.marketgateway.routing.RouteRegistry;
import com.nepsegateway.marketgateway.validation.StockValidator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/** Tools and prompts exposed over the agent-tool endpoint. */
@Component
public class ToolRegistry {

  private static final String SYMBOL_DESCRIPTION = "Stock symbol, for example NABIL";
  private static final String VALIDATION_KEY = "/validate";

  private final Map<String, ToolDefinition> tools;
  private final Map<String, PromptDefinition> prompts;

  public ToolRegistry(RouteDispatcher dispatcher, StockValidator validator) {
    List<ToolDefinition> toolDefs = new ArrayList<>();
    toolDefs.add(
        route(
            dispatcher,
            "get_market_summary",
            "Summary",
            "Get the latest NEPSE market summary including key metrics."));
    toolDefs.add(
        route(
            dispatcher,
            "get_live_market",
            "LiveMarket",
            "Get real-time live market data for all securities. Only while the market is open."));
    toolDefs.add(
        route(
            dispatcher,
            "get_price_volume",
            "PriceVolume",
            "Get price and volume data for all stocks."));
    toolDefs.add(
        route(dispatcher, "get_top_gainers", "TopGainers", "Get the list of top gaining stocks."));
    toolDefs.add(
        route(dispatcher, "get_top_losers", "TopLosers", "Get the list of top losing stocks."));
    toolDefs.add(
        route(
            dispatcher,
            "get_nepse_index",
            "NepseIndex",
            "Get NEPSE index information keyed by index name."));
    toolDefs.add(
        route(
            dispatcher,
            "get_sector_indices",
            "NepseSubIndices",
            "Get sub-indices for all sectors."));
    toolDefs.add(
        route(
            dispatcher,
            "check_market_status",
            "IsNepseOpen",
            "Check whether the NEPSE market is currently open."));
    toolDefs.add(
        route(
            dispatcher,
            "get_company_list",
            "CompanyList",
            "Get the list of all companies listed in NEPSE."));
    toolDefs.add(
        route(
            dispatcher,
            "get_supply_demand",
            "SupplyDemand",
            "Get supply and demand data. Only works while the market is open."));
    toolDefs.add(
        route(
            dispatcher,
            "get_top_turnover",
            "TopTenTurnoverScrips",
            "Get top companies by turnover."));
    toolDefs.add(
        route(
            dispatcher,
            "get_comprehensive_market_data",
            RouteRegistry.MARKET_OVERVIEW,
            "Get per-scrip and per-sector trade, turnover and transaction details."));
    toolDefs.add(
        route(
            dispatcher,
            "get_floorsheet",
            "Floorsheet",
            "Get today's floorsheet (all executed contracts). Only after the market closes."));
    toolDefs.add(
        symbolRoute(
            dispatcher,
            "get_company_details",
            "CompanyDetails",
            "Get detailed information about a specific company."));
    toolDefs.add(
        symbolRoute(
            dispatcher,
            "get_company_floorsheet",
            "FloorsheetOf",
            "Get floorsheet data for a specific company. Only works after the market closes."));
    toolDefs.add(
        symbolRoute(
            dispatcher,
            "get_price_history",
            "PriceVolumeHistory",
            "Get historical price and volume data for a company."));
    toolDefs.add(
        symbolRoute(
            dispatcher,
            "get_market_depth",
            "MarketDepth",
            "Get market depth (bid/ask) for a stock. Only works while the market is open."));

    toolDefs.add(
        new ToolDefinition(
            "validate_stock_symbol_tool",
            "Check whether a stock symbol exists in NEPSE, with suggestions when it does not.",
            List.of(ToolArgument.required(RouteRegistry.SYMBOL, SYMBOL_DESCRIPTION)),
            VALIDATION_KEY,
            args ->
                Map.of(
                    "validation_result",
                    validator.validateStockSymbol(
                        require("validate_stock_symbol_tool", args, RouteRegistry.SYMBOL)))));
    toolDefs.add(
        new ToolDefinition(
            "get_validation_stats",
            "Get validation statistics and the available stocks and indices.",
            List.of(),
            VALIDATION_KEY,
            args -> Map.of("stats", validator.stats())));
    toolDefs.add(
        new ToolDefinition(
            "find_symbol_by_company_name",
            "Find stock symbols by a word of the company name, for example 'Nabil'.",
            List.of(ToolArgument.required("company_name", "Company name or a word of it")),
            VALIDATION_KEY,
            args ->
                validator.findSymbolByCompanyName(
                    require("find_symbol_by_company_name", args, "company_name"))));
    toolDefs.add(
        new ToolDefinition(
            "find_company_by_symbol",
            "Find the company name for a stock symbol.",
            List.of(ToolArgument.required(RouteRegistry.SYMBOL, SYMBOL_DESCRIPTION)),
            VALIDATION_KEY,
            args ->
                validator.findCompanyNameBySymbol(
                    require("find_company_by_symbol", args, RouteRegistry.SYMBOL))));

    this.tools = index(toolDefs, ToolDefinition::name);
    this.prompts = index(cannedPrompts(), PromptDefinition::name);
  }

  public Optional<ToolDefinition> tool(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
  }

  public List<ToolDefinition> tools() {
    return List.copyOf(tools.values());
  }

  public Optional<PromptDefinition> prompt(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(prompts.get(name));
  }

  public List<PromptDefinition> prompts() {
    return List.copyOf(prompts.values());
  }

  private static ToolDefinition route(
      RouteDispatcher dispatcher, String name, String route, String description) {
    return new ToolDefinition(
        name, description, List.of(), route, args -> dispatcher.dispatch(route, args));
  }

  private static ToolDefinition symbolRoute(
      RouteDispatcher dispatcher, String name, String route, String description) {
    return new ToolDefinition(
        name,
        description,
        List.of(ToolArgument.required(RouteRegistry.SYMBOL, SYMBOL_DESCRIPTION)),
        route,
        args -> dispatcher.dispatch(route, args));
  }

  private static String require(String tool, Map<String, String> args, String name) {
    String value = args.get(name);
    if (value == null || value.isBlank()) {
      throw new MissingParameterException(tool, name);
    }
    return value;
  }

  private static List<PromptDefinition> cannedPrompts() {
    ToolArgument symbol = ToolArgument.required(RouteRegistry.SYMBOL, SYMBOL_DESCRIPTION);
    return List.of(
        new PromptDefinition(
            "stock-quick-lookup",
            "Get a quick summary of a stock's current price, volume, and latest trades.",
            List.of(symbol),
            a -> "Show me a quick summary for " + a.get("symbol") + "."),
        new PromptDefinition(
            "market-sentiment-snapshot",
            "Get a snapshot of today's top gainers, losers, and overall market mood.",
            List.of(),
            a -> "Give me today's top gainers, losers, and a market summary."),
        new PromptDefinition(
            "sector-performance",
            "Analyze the performance of a specific sector today.",
            List.of(ToolArgument.required("sector", "Sector name, for example Hydro Power")),
            a -> "Analyze today's performance for the " + a.get("sector") + " sector."),
        new PromptDefinition(
            "company-deep-dive",
            "Get a detailed report on a company: profile, price history, and recent trades.",
            List.of(symbol),
            a ->
                "Give me a detailed report for "
                    + a.get("symbol")
                    + ", including profile, price history, and recent trades."),
        new PromptDefinition(
            "live-market-watchlist",
            "Monitor live prices and volumes for a custom list of stocks.",
            List.of(ToolArgument.required("symbols", "Comma-separated stock symbols")),
            a -> "Show me live prices and volumes for: " + a.get("symbols")),
        new PromptDefinition(
            "market-depth-analyzer",
            "Analyze the current bid/ask depth for a stock (only when market is open).",
            List.of(symbol),
            a -> "Analyze the current market depth for " + a.get("symbol") + "."),
        new PromptDefinition(
            "post-market-trade-explorer",
            "Explore all trades for a stock after market close (floorsheet).",
            List.of(symbol),
            a -> "Show me all trades for " + a.get("symbol") + " after market close."),
        new PromptDefinition(
            "validate-stock-symbol",
            "Check if a stock symbol is valid and get suggestions if not.",
            List.of(symbol),
            a -> "Validate the stock symbol: " + a.get("symbol")),
        new PromptDefinition(
            "market-open-status",
            "Check if the NEPSE market is currently open or closed.",
            List.of(),
            a -> "Is the NEPSE market currently open or closed?"),
        new PromptDefinition(
            "setup-alert",
            "Set up a price or volume alert for a stock.",
            List.of(
                symbol,
                ToolArgument.required("type", "What to watch: price or volume"),
                ToolArgument.required("threshold", "Value that triggers the alert")),
            a ->
                "Set up an alert for "
                    + a.get("symbol")
                    + " when "
                    + a.get("type")
                    + " crosses "
                    + a.get("threshold")
                    + "."));
  }

  private static <T> Map<String, T> index(List<T> defs, Function<T, String> name) {
    Map<String, T> map = new LinkedHashMap<>();
    for (T def : defs) {
      if (map.putIfAbsent(name.apply(def), def) != null) {
        throw new IllegalStateException("Duplicate definition " + name.apply(def));
      }
    }
    return Collections.unmodifiableMap(map);
  }
}
