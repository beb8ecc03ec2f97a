package com.nepsegateway.marketgateway.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Answers "is this a listed symbol / known index" against the snapshot, with prefix suggestions
 * and a deliberately simple first-significant-word company search.
 */
@Service
public class StockValidator {

  static final int MAX_SUGGESTIONS = 5;
  static final int MAX_COMPANY_MATCHES = 10;
  private static final int SAMPLE_SIZE = 10;

  /**
   * Display names plus the abbreviated variants upstream payloads still use. Both are accepted.
   */
  static final Set<String> INDEX_NAMES =
      new LinkedHashSet<>(
          List.of(
              "Banking SubIndex",
              "Development Bank Index",
              "Finance Index",
              "Hotels And Tourism Index",
              "HydroPower Index",
              "Investment Index",
              "Life Insurance",
              "Manufacturing And Processing",
              "Microfinance Index",
              "Mutual Fund",
              "NEPSE Index",
              "Non Life Insurance",
              "Others Index",
              "Trading Index",
              "Development Bank Ind.",
              "Hotels And Tourism",
              "Investment",
              "Manufacturing And Pr."));

  private final StockSnapshotStore snapshotStore;

  public StockValidator(StockSnapshotStore snapshotStore) {
    this.snapshotStore = snapshotStore;
  }

  public ValidationResult validateStockSymbol(String input) {
    String symbol = input == null ? "" : input.trim().toUpperCase(Locale.ROOT);
    if (symbol.isEmpty()) {
      return ValidationResult.invalidStock(null, "Stock symbol is required", List.of());
    }
    StockRecord info = snapshotStore.stocks().get(symbol);
    if (info != null) {
      return ValidationResult.validStock(symbol, info);
    }
    return ValidationResult.invalidStock(
        symbol,
        "Stock symbol '" + symbol + "' not found. Check that it is a listed company.",
        suggestionsFor(symbol));
  }

  public ValidationResult validateIndexName(String input) {
    String indexName = input == null ? "" : input.trim();
    if (indexName.isEmpty()) {
      return ValidationResult.invalidIndex(null, "Index name is required", availableIndices());
    }
    if (INDEX_NAMES.contains(indexName)) {
      return ValidationResult.validIndex(indexName);
    }
    return ValidationResult.invalidIndex(
        indexName, "Index '" + indexName + "' not found.", availableIndices());
  }

  public CompanySearchResult findSymbolByCompanyName(String query) {
    String queryKey = CompanyNameNormalizer.key(query);
    if (queryKey.isEmpty()) {
      return new CompanySearchResult(query, false, List.of(), 0);
    }
    List<CompanyMatch> exact = new ArrayList<>();
    List<CompanyMatch> partial = new ArrayList<>();
    for (Map.Entry<String, StockRecord> entry : snapshotStore.stocks().entrySet()) {
      StockRecord info = entry.getValue();
      String stripped = CompanyNameNormalizer.stripSuffix(info.name());
      String nameKey = CompanyNameNormalizer.key(info.name());
      if (nameKey.equals(queryKey)) {
        exact.add(match(entry.getKey(), info, CompanyMatch.MatchType.EXACT));
      } else if (!nameKey.isEmpty()
          && (nameKey.startsWith(queryKey) || stripped.contains(queryKey))) {
        partial.add(match(entry.getKey(), info, CompanyMatch.MatchType.PARTIAL));
      }
    }
    List<CompanyMatch> ranked = new ArrayList<>(exact);
    ranked.addAll(partial);
    int total = ranked.size();
    List<CompanyMatch> capped =
        ranked.size() > MAX_COMPANY_MATCHES ? ranked.subList(0, MAX_COMPANY_MATCHES) : ranked;
    return new CompanySearchResult(query, total > 0, List.copyOf(capped), total);
  }

  public CompanyLookupResult findCompanyNameBySymbol(String input) {
    String symbol = input == null ? "" : input.trim().toUpperCase(Locale.ROOT);
    StockRecord info = symbol.isEmpty() ? null : snapshotStore.stocks().get(symbol);
    if (info == null) {
      return new CompanyLookupResult(symbol, false, null, null);
    }
    return new CompanyLookupResult(symbol, true, info.name(), info);
  }

  public ValidationStats stats() {
    Map<String, StockRecord> stocks = snapshotStore.stocks();
    List<String> sample = stocks.keySet().stream().limit(SAMPLE_SIZE).toList();
    return new ValidationStats(stocks.size(), INDEX_NAMES.size(), sample, availableIndices());
  }

  public List<String> availableIndices() {
    return List.copyOf(INDEX_NAMES);
  }

  private List<String> suggestionsFor(String symbol) {
    String prefix = symbol.substring(0, Math.min(2, symbol.length()));
    List<String> suggestions = new ArrayList<>(MAX_SUGGESTIONS);
    for (String candidate : snapshotStore.stocks().keySet()) {
      if (candidate.startsWith(prefix)) {
        suggestions.add(candidate);
        if (suggestions.size() >= MAX_SUGGESTIONS) {
          break;
        }
      }
    }
    return suggestions;
  }

  private static CompanyMatch match(String symbol, StockRecord info, CompanyMatch.MatchType type) {
    return new CompanyMatch(symbol, info.name(), info.sector(), type);
  }
}
