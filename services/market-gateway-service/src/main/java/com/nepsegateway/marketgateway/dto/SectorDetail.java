package com.nepsegateway.marketgateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/**
 * Per-sector rollup of the surviving scrips. {@code turnover} is the sector's live sub-index
 * record, or null when it could not be resolved.
 */
public record SectorDetail(
    BigDecimal transaction,
    BigDecimal volume,
    BigDecimal totalTurnover,
    JsonNode turnover,
    String sectorName) {}
