package com.nepsegateway.marketgateway.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reduces a company's legal name to the one word people actually type: lower-case, drop the
 * corporate-form suffix, then take the first token longer than two characters that is not an
 * article. "Nepal Life Insurance Limited" and "nepal" both reduce to {@code nepal}.
 */
final class CompanyNameNormalizer {

  // Sorted longest first so "development bank limited" wins over "limited".
  private static final List<String> CORPORATE_SUFFIXES =
      List.of(
              "microfinance bittiya sanstha limited",
              "microfinance bittiya sanstha ltd",
              "laghubitta bittiya sanstha limited",
              "laghubitta bittiya sanstha ltd",
              "bittiya sanstha limited",
              "bittiya sanstha ltd",
              "development bank limited",
              "development bank ltd",
              "limited",
              "ltd")
          .stream()
          .sorted(Comparator.comparingInt(String::length).reversed())
          .toList();

  private static final Set<String> ARTICLES = Set.of("the", "a", "an");

  private CompanyNameNormalizer() {}

  /** Lower-cased name with trailing punctuation and the longest matching suffix removed. */
  static String stripSuffix(String name) {
    if (name == null) {
      return "";
    }
    String value = trimTrailingPunctuation(name.toLowerCase(Locale.ROOT).trim());
    for (String suffix : CORPORATE_SUFFIXES) {
      if (value.equals(suffix)) {
        return "";
      }
      if (value.endsWith(" " + suffix)) {
        return trimTrailingPunctuation(value.substring(0, value.length() - suffix.length()).trim());
      }
    }
    return value;
  }

  /** First significant token of the stripped name, or empty when there is none. */
  static String key(String name) {
    String stripped = stripSuffix(name);
    for (String token : stripped.split("[^\\p{L}\\p{Nd}]+")) {
      if (token.length() > 2 && !ARTICLES.contains(token)) {
        return token;
      }
    }
    return "";
  }

  private static String trimTrailingPunctuation(String value) {
    int end = value.length();
    while (end > 0 && (value.charAt(end - 1) == '.' || value.charAt(end - 1) == ',')) {
      end--;
    }
    return value.substring(0, end).trim();
  }
}
