package com.nepsegateway.marketgateway.validation;

import java.util.List;

/** {@code totalMatches} counts every hit; {@code matches} is capped. */
public record CompanySearchResult(
    String query, boolean found, List<CompanyMatch> matches, int totalMatches) {}
