package com.nepsegateway.marketgateway.api;

import com.nepsegateway.marketgateway.validation.CompanyLookupResult;
import com.nepsegateway.marketgateway.validation.CompanySearchResult;
import com.nepsegateway.marketgateway.validation.StockValidator;
import com.nepsegateway.marketgateway.validation.ValidationResult;
import com.nepsegateway.marketgateway.validation.ValidationStats;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class ValidationController {

  private final StockValidator validator;

  public ValidationController(StockValidator validator) {
    this.validator = validator;
  }

  @GetMapping("/validate/stock/{symbol}")
  public ResponseEntity<ValidationResult> validateStock(@PathVariable String symbol) {
    ValidationResult result = validator.validateStockSymbol(symbol);
    return CachedResponses.status(result.valid() ? HttpStatus.OK : HttpStatus.NOT_FOUND, result);
  }

  @GetMapping("/validate/index/{indexName}")
  public ResponseEntity<ValidationResult> validateIndex(@PathVariable String indexName) {
    ValidationResult result = validator.validateIndexName(indexName);
    return CachedResponses.status(result.valid() ? HttpStatus.OK : HttpStatus.NOT_FOUND, result);
  }

  @GetMapping("/validate/company")
  public ResponseEntity<CompanySearchResult> findByCompanyName(
      @RequestParam @NotBlank String name) {
    return CachedResponses.ok(validator.findSymbolByCompanyName(name));
  }

  @GetMapping("/validate/symbol/{symbol}/company")
  public ResponseEntity<CompanyLookupResult> findCompanyBySymbol(@PathVariable String symbol) {
    CompanyLookupResult result = validator.findCompanyNameBySymbol(symbol);
    return CachedResponses.status(result.found() ? HttpStatus.OK : HttpStatus.NOT_FOUND, result);
  }

  @GetMapping("/validation/stats")
  public ResponseEntity<ValidationStats> stats() {
    return CachedResponses.ok(validator.stats());
  }
}
