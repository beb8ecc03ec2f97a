package com.nepsegateway.marketgateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.config.UpstreamProperties;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Thin GET-by-path wrapper around the upstream market data API. Every call goes to the network;
 * memoization lives in {@link EndpointResponseCache}.
 */
@Component
public class UpstreamClient {
  private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

  private final WebClient webClient;
  private final UpstreamProperties properties;

  public UpstreamClient(WebClient upstreamWebClient, UpstreamProperties properties) {
    this.webClient = upstreamWebClient;
    this.properties = properties;
  }

  public JsonNode fetch(String path) {
    return fetch(path, properties.timeout());
  }

  public JsonNode fetch(String path, Duration timeout) {
    log.info("Upstream request {}", path);
    JsonNode response;
    try {
      response =
          webClient
              .get()
              .uri(path)
              .accept(MediaType.APPLICATION_JSON)
              .exchangeToMono(
                  clientResponse -> {
                    if (clientResponse.statusCode().isError()) {
                      return clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .flatMap(
                              body ->
                                  Mono.error(
                                      new UpstreamUnavailableException(
                                          path,
                                          "Upstream error "
                                              + clientResponse.statusCode().value()
                                              + " for "
                                              + path
                                              + abbreviate(body))));
                    }
                    MediaType contentType =
                        clientResponse
                            .headers()
                            .contentType()
                            .orElse(MediaType.APPLICATION_OCTET_STREAM);
                    if (isJson(contentType)) {
                      return clientResponse.bodyToMono(JsonNode.class);
                    }
                    return clientResponse
                        .releaseBody()
                        .then(
                            Mono.error(
                                new UpstreamUnavailableException(
                                    path,
                                    "Upstream returned non-JSON response ("
                                        + contentType
                                        + ") for "
                                        + path)));
                  })
              .block(timeout);
    } catch (UpstreamUnavailableException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new UpstreamUnavailableException(
          path, "Upstream request failed for " + path + ": " + ex.getMessage(), ex);
    }
    if (response == null) {
      throw new UpstreamUnavailableException(path, "Upstream returned empty response for " + path);
    }
    return response;
  }

  private static boolean isJson(MediaType contentType) {
    if (contentType == null) {
      return false;
    }
    if (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
      return true;
    }
    String subtype = contentType.getSubtype();
    return subtype != null && subtype.toLowerCase(Locale.ROOT).endsWith("+json");
  }

  private static String abbreviate(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    String trimmed = body.strip();
    return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed);
  }
}
