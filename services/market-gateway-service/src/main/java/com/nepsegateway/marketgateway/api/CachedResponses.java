package com.nepsegateway.marketgateway.api;

import java.time.Duration;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Successful responses may be cached by clients for 30 seconds. */
final class CachedResponses {
  private static final CacheControl PUBLIC_30S =
      CacheControl.maxAge(Duration.ofSeconds(30)).cachePublic();

  private CachedResponses() {}

  static <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok().cacheControl(PUBLIC_30S).body(body);
  }

  static <T> ResponseEntity<T> status(HttpStatus status, T body) {
    if (status.is2xxSuccessful()) {
      return ResponseEntity.status(status).cacheControl(PUBLIC_30S).body(body);
    }
    return ResponseEntity.status(status).body(body);
  }
}
