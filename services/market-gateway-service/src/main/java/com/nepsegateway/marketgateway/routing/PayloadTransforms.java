package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.function.UnaryOperator;

/** Reshapes applied to upstream list payloads before they are returned. */
final class PayloadTransforms {

  private PayloadTransforms() {}

  static UnaryOperator<JsonNode> identity() {
    return UnaryOperator.identity();
  }

  /** {@code [{detail, value}, ...]} into {@code {detail: value, ...}}. */
  static UnaryOperator<JsonNode> detailToValue() {
    return payload -> {
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      for (JsonNode item : payload) {
        JsonNode detail = item.get("detail");
        if (detail != null && !detail.isNull()) {
          out.set(detail.asText(), item.path("value"));
        }
      }
      return out;
    };
  }

  /** {@code [{field: k, ...}, ...]} into {@code {k: {field: k, ...}, ...}}. */
  static UnaryOperator<JsonNode> keyedBy(String field) {
    return payload -> {
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      for (JsonNode item : payload) {
        JsonNode key = item.get(field);
        if (key != null && !key.isNull()) {
          out.set(key.asText(), item);
        }
      }
      return out;
    };
  }
}
