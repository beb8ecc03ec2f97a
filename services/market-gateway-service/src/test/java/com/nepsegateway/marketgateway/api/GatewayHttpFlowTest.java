package com.nepsegateway.marketgateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.client.UpstreamPaths;
import com.nepsegateway.marketgateway.client.UpstreamUnavailableException;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitHeaders;
import com.nepsegateway.marketgateway.support.GatewayIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

class GatewayHttpFlowTest extends GatewayIntegrationTest {

  @Test
  void healthCarriesQuotaAndCacheHeaders() {
    ResponseEntity<String> response = get("/health");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    HttpHeaders headers = response.getHeaders();
    assertThat(headers.getFirst(RateLimitHeaders.LIMIT)).isEqualTo("3");
    assertThat(headers.getFirst(RateLimitHeaders.REMAINING)).isEqualTo("2");
    assertThat(headers.getFirst(RateLimitHeaders.CATEGORY)).isEqualTo("health");
    assertThat(headers.getFirst(RateLimitHeaders.RESET)).isNotBlank();
    assertThat(headers.getFirst(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");
    assertThat(headers.getCacheControl()).contains("max-age=30");
    assertThat(response.getBody()).contains("healthy");
  }

  @Test
  void requestOverTheLimitIsRejected() throws Exception {
    for (int i = 0; i < 3; i++) {
      assertThat(get("/health").getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    ResponseEntity<String> rejected = get("/health");

    assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(rejected.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isNotBlank();
    assertThat(rejected.getHeaders().getFirst(RateLimitHeaders.REMAINING)).isEqualTo("0");
    assertThat(rejected.getHeaders().getCacheControl()).isNull();
    JsonNode body = objectMapper.readTree(rejected.getBody());
    assertThat(body.get("code").asText()).isEqualTo("RATE_LIMIT_EXCEEDED");
    assertThat(body.at("/details/category").asText()).isEqualTo("health");
  }

  @Test
  void routeIndexListsEveryRoute() throws Exception {
    JsonNode index = objectMapper.readTree(get("/").getBody());

    assertThat(index.get("Health").asText()).isEqualTo("/health");
    assertThat(index.get("TradeTurnoverTransactionSubindices").asText())
        .isEqualTo("/TradeTurnoverTransactionSubindices");
    assertThat(index.get("DailyNepseIndexGraph").asText()).isEqualTo("/DailyNepseIndexGraph");
  }

  @Test
  void summaryIsReshapedIntoAnObject() throws Exception {
    when(upstream.fetch(UpstreamPaths.MARKET_SUMMARY))
        .thenReturn(
            objectMapper.readTree(
                "[{\"detail\":\"Total Turnover Rs:\",\"value\":3.5E9},"
                    + "{\"detail\":\"Total Scrips Traded\",\"value\":241}]"));

    ResponseEntity<String> response = get("/Summary");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst(RateLimitHeaders.CATEGORY))
        .isEqualTo("market_data");
    JsonNode body = objectMapper.readTree(response.getBody());
    assertThat(body.get("Total Scrips Traded").asInt()).isEqualTo(241);
  }

  @Test
  void unknownSymbolIsRejectedWithSuggestions() throws Exception {
    ResponseEntity<String> response = get("/PriceVolumeHistory?symbol=nabx");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    JsonNode body = objectMapper.readTree(response.getBody());
    assertThat(body.get("code").asText()).isEqualTo("VALIDATION_FAILED");
    assertThat(body.at("/details/suggestions/0").asText()).isEqualTo("NABIL");
    verify(upstream, never()).fetch("/price-volume-history/NABX");
  }

  @Test
  void missingSymbolIsABadRequest() throws Exception {
    ResponseEntity<String> response = get("/DailyScripPriceGraph");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(objectMapper.readTree(response.getBody()).get("code").asText())
        .isEqualTo("MISSING_PARAMETER");
  }

  @Test
  void unknownRouteIsNotFound() throws Exception {
    ResponseEntity<String> response = get("/NoSuchThing");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(objectMapper.readTree(response.getBody()).get("code").asText())
        .isEqualTo("ROUTE_NOT_FOUND");
  }

  @Test
  void openMarketRouteConflictsWhileClosed() throws Exception {
    ResponseEntity<String> response = get("/SupplyDemand");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(objectMapper.readTree(response.getBody()).get("code").asText())
        .isEqualTo("MARKET_CLOSED");
    verify(upstream, never()).fetch(UpstreamPaths.SUPPLY_DEMAND);
  }

  @Test
  void upstreamFailureIsABadGatewayAndNotCached() throws Exception {
    when(upstream.fetch(UpstreamPaths.TOP_TRANSACTION))
        .thenThrow(new UpstreamUnavailableException(UpstreamPaths.TOP_TRANSACTION, "refused"));

    ResponseEntity<String> response = get("/TopTenTransactionScrips");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getHeaders().getCacheControl()).isNull();
    assertThat(objectMapper.readTree(response.getBody()).get("code").asText())
        .isEqualTo("UPSTREAM_UNAVAILABLE");
  }

  @Test
  void validationEndpoints() throws Exception {
    ResponseEntity<String> known = get("/validate/stock/nabil");
    ResponseEntity<String> unknown = get("/validate/stock/ZZZZ");
    ResponseEntity<String> index = get("/validate/index/Finance Index");
    ResponseEntity<String> company = get("/validate/company?name=Nepal");
    ResponseEntity<String> blank = get("/validate/company?name=");

    assertThat(known.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(objectMapper.readTree(known.getBody()).get("symbol").asText()).isEqualTo("NABIL");
    assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(index.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(objectMapper.readTree(company.getBody()).get("totalMatches").asInt()).isEqualTo(2);
    assertThat(blank.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(known.getHeaders().getFirst(RateLimitHeaders.CATEGORY)).isEqualTo("validation");
  }

  @Test
  void companyLookupBySymbol() throws Exception {
    ResponseEntity<String> found = get("/validate/symbol/upper/company");
    ResponseEntity<String> missing = get("/validate/symbol/NOPE/company");

    assertThat(found.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(objectMapper.readTree(found.getBody()).get("companyName").asText())
        .isEqualTo("Upper Tamakoshi Hydropower Limited");
    assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void rateLimitStatsAreExposed() throws Exception {
    get("/health");

    JsonNode stats = objectMapper.readTree(get("/rate-limit/stats").getBody());

    assertThat(stats.get("totalTrackedClients").asInt()).isPositive();
  }

  @Test
  void toolEndpointAnswersPing() throws Exception {
    HttpHeaders headers = headers();
    headers.setContentType(MediaType.APPLICATION_JSON);
    ResponseEntity<String> response =
        http.exchange(
            url("/mcp"),
            HttpMethod.POST,
            new HttpEntity<>("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}", headers),
            String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst(RateLimitHeaders.LIMIT)).isNull();
    assertThat(objectMapper.readTree(response.getBody()).get("result").isObject()).isTrue();
  }

  private ResponseEntity<String> get(String path) {
    return http.exchange(url(path), HttpMethod.GET, new HttpEntity<>(headers()), String.class);
  }

  private HttpHeaders headers() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Forwarded-For", clientAddress);
    return headers;
  }
}
