package com.nepsegateway.marketgateway.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of a symbol or index check. A valid result carries the canonical value; an invalid one
 * carries the reason and whatever suggestions could be found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
    boolean valid,
    String symbol,
    String indexName,
    StockRecord info,
    String error,
    List<String> suggestions,
    List<String> availableIndices) {

  public static ValidationResult validStock(String symbol, StockRecord info) {
    return new ValidationResult(true, symbol, null, info, null, null, null);
  }

  public static ValidationResult invalidStock(
      String symbol, String error, List<String> suggestions) {
    return new ValidationResult(false, symbol, null, null, error, List.copyOf(suggestions), null);
  }

  public static ValidationResult validIndex(String indexName) {
    return new ValidationResult(true, null, indexName, null, null, null, null);
  }

  public static ValidationResult invalidIndex(
      String indexName, String error, List<String> availableIndices) {
    return new ValidationResult(
        false, null, indexName, null, error, null, List.copyOf(availableIndices));
  }

  /** Canonical symbol or index name, whichever this result is about. */
  @JsonIgnore
  public String canonicalValue() {
    return symbol != null ? symbol : indexName;
  }
}
