package com.nepsegateway.marketgateway.common.ratelimit;

import java.util.Map;

public record RateLimitStats(
    int totalTrackedClients,
    int totalTrackedWindows,
    int activeRequestsInWindow,
    long windowSizeSeconds,
    Map<String, Integer> limits,
    long idleEvictionSeconds) {}
