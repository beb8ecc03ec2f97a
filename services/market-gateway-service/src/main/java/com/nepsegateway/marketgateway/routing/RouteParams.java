package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flattens a JSON params object from a message-based transport into route parameters. */
public final class RouteParams {

  private RouteParams() {}

  public static Map<String, String> fromJson(JsonNode params) {
    Map<String, String> out = new LinkedHashMap<>();
    if (params == null || !params.isObject()) {
      return out;
    }
    params
        .fields()
        .forEachRemaining(
            entry -> {
              JsonNode value = entry.getValue();
              if (value != null && value.isValueNode() && !value.isNull()) {
                out.put(entry.getKey(), value.asText());
              }
            });
    return out;
  }
}
