package com.nepsegateway.marketgateway.dto;

import java.util.Map;

public record MarketOverview(
    Map<String, ScripDetail> scripsDetails, Map<String, SectorDetail> sectorsDetails) {}
