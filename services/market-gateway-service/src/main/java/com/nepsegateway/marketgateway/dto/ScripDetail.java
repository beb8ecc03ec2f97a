package com.nepsegateway.marketgateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public record ScripDetail(
    String symbol,
    String sector,
    @JsonProperty("Turnover") BigDecimal turnover,
    BigDecimal transaction,
    BigDecimal volume,
    BigDecimal previousClose,
    String lastUpdatedDateTime,
    String name,
    String category,
    BigDecimal pointChange,
    BigDecimal percentageChange,
    BigDecimal ltp) {}
