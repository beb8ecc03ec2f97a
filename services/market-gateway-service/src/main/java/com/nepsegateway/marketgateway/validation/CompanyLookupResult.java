package com.nepsegateway.marketgateway.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompanyLookupResult(
    String symbol, boolean found, String companyName, StockRecord fullInfo) {}
