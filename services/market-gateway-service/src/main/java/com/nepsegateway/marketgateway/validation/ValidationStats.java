package com.nepsegateway.marketgateway.validation;

import java.util.List;

public record ValidationStats(
    int totalStocks, int totalIndices, List<String> sampleStocks, List<String> availableIndices) {}
