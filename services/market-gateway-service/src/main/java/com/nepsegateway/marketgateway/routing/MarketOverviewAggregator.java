package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.client.EndpointResponseCache;
import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.dto.MarketOverview;
import com.nepsegateway.marketgateway.dto.ScripDetail;
import com.nepsegateway.marketgateway.dto.SectorDetail;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Joins company list, top-N lists, price-volume and sub-indices into per-scrip details and
 * per-sector rollups. Each call builds a fresh result; only the underlying fetches are cached.
 */
@Service
@Slf4j
public class MarketOverviewAggregator {

  /** Sector names as used in the company list, mapped to their sub-index label. */
  static final Map<String, String> SECTOR_SUBINDEX =
      Map.ofEntries(
          Map.entry("Commercial Banks", "Banking SubIndex"),
          Map.entry("Development Banks", "Development Bank Index"),
          Map.entry("Finance", "Finance Index"),
          Map.entry("Hotels And Tourism", "Hotels And Tourism Index"),
          Map.entry("Hydro Power", "HydroPower Index"),
          Map.entry("Investment", "Investment Index"),
          Map.entry("Life Insurance", "Life Insurance"),
          Map.entry("Manufacturing And Processing", "Manufacturing And Processing"),
          Map.entry("Microfinance", "Microfinance Index"),
          Map.entry("Mutual Fund", "Mutual Fund"),
          Map.entry("Non Life Insurance", "Non Life Insurance"),
          Map.entry("Others", "Others Index"),
          Map.entry("Tradings", "Trading Index"));

  private final EndpointResponseCache cache;

  public MarketOverviewAggregator(EndpointResponseCache cache) {
    this.cache = cache;
  }

  public MarketOverview buildMarketOverview() {
    JsonNode companies = cache.fetch(UpstreamPaths.COMPANY_LIST);
    Map<String, JsonNode> turnover = indexBy(cache.fetch(UpstreamPaths.TOP_TURNOVER), "symbol");
    Map<String, JsonNode> transaction =
        indexBy(cache.fetch(UpstreamPaths.TOP_TRANSACTION), "symbol");
    Map<String, JsonNode> trade = indexBy(cache.fetch(UpstreamPaths.TOP_TRADE), "symbol");
    Map<String, JsonNode> gainers = indexBy(cache.fetch(UpstreamPaths.TOP_GAINERS), "symbol");
    Map<String, JsonNode> losers = indexBy(cache.fetch(UpstreamPaths.TOP_LOSERS), "symbol");
    Map<String, JsonNode> priceVolume =
        indexBy(cache.fetch(UpstreamPaths.PRICE_VOLUME), "symbol");
    Map<String, JsonNode> subIndices =
        indexBy(cache.fetch(UpstreamPaths.NEPSE_SUBINDICES), "index");

    Map<String, ScripDetail> scrips = new LinkedHashMap<>();
    Map<String, SectorTotals> sectors = new LinkedHashMap<>();

    for (JsonNode company : iterable(companies)) {
      String symbol = text(company, "symbol");
      String sector = text(company, "sectorName");
      if (symbol == null || sector == null) {
        log.warn("Skipping company without symbol or sector: {}", company);
        continue;
      }
      sectors.computeIfAbsent(sector, s -> new SectorTotals());

      JsonNode priceInfo = priceVolume.get(symbol);
      JsonNode mover = gainers.containsKey(symbol) ? gainers.get(symbol) : losers.get(symbol);

      ScripDetail detail =
          new ScripDetail(
              symbol,
              sector,
              decimal(turnover.get(symbol), "turnover"),
              decimal(transaction.get(symbol), "totalTrades"),
              decimal(trade.get(symbol), "shareTraded"),
              decimal(priceInfo, "previousClose"),
              priceInfo == null ? null : text(priceInfo, "lastUpdatedDateTime"),
              company.path("securityName").asText(""),
              text(company, "instrumentType"),
              decimal(mover, "pointChange"),
              decimal(mover, "percentageChange"),
              decimal(mover, "ltp"));

      // No last trade or no previous close: not trading today.
      if (detail.ltp().signum() == 0 || detail.previousClose().signum() == 0) {
        continue;
      }
      scrips.put(symbol, detail);
      sectors.get(sector).add(detail);
    }

    Map<String, SectorDetail> sectorDetails = new LinkedHashMap<>();
    sectors.forEach(
        (sector, totals) ->
            sectorDetails.put(
                sector,
                new SectorDetail(
                    totals.transaction,
                    totals.volume,
                    totals.turnover,
                    subIndexFor(sector, subIndices),
                    sector)));

    return new MarketOverview(
        Collections.unmodifiableMap(scrips), Collections.unmodifiableMap(sectorDetails));
  }

  private static JsonNode subIndexFor(String sector, Map<String, JsonNode> subIndices) {
    String label = SECTOR_SUBINDEX.get(sector);
    if (label == null) {
      log.warn("No sub-index mapping for sector '{}'", sector);
      return null;
    }
    JsonNode subIndex = subIndices.get(label);
    if (subIndex == null) {
      log.warn("Sub-index '{}' for sector '{}' missing from upstream payload", label, sector);
    }
    return subIndex;
  }

  private static Map<String, JsonNode> indexBy(JsonNode payload, String field) {
    Map<String, JsonNode> out = new LinkedHashMap<>();
    for (JsonNode item : iterable(payload)) {
      String key = text(item, field);
      if (key != null) {
        out.put(key, item);
      }
    }
    return out;
  }

  private static Iterable<JsonNode> iterable(JsonNode payload) {
    if (payload == null || !payload.isArray()) {
      return List.of();
    }
    return payload;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static BigDecimal decimal(JsonNode node, String field) {
    if (node == null) {
      return BigDecimal.ZERO;
    }
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return BigDecimal.ZERO;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    try {
      return new BigDecimal(value.asText().trim());
    } catch (NumberFormatException e) {
      log.warn("Non-numeric {} value '{}', using 0", field, value.asText());
      return BigDecimal.ZERO;
    }
  }

  private static final class SectorTotals {
    private BigDecimal transaction = BigDecimal.ZERO;
    private BigDecimal volume = BigDecimal.ZERO;
    private BigDecimal turnover = BigDecimal.ZERO;

    void add(ScripDetail detail) {
      transaction = transaction.add(detail.transaction());
      volume = volume.add(detail.volume());
      turnover = turnover.add(detail.turnover());
    }
  }
}
