package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.springframework.web.util.UriUtils;

/**
 * One logical operation of the gateway. Each variant tells the dispatcher how to obtain the
 * payload; {@link RouteDispatcher} handles every variant.
 */
public sealed interface RouteDescriptor
    permits RouteDescriptor.Passthrough,
        RouteDescriptor.Parameterized,
        RouteDescriptor.Composite {

  String name();

  MarketPrecondition precondition();

  default List<String> requiredParams() {
    return List.of();
  }

  /** Fixed upstream path, optionally reshaped. */
  record Passthrough(
      String name, String path, UnaryOperator<JsonNode> transform, MarketPrecondition precondition)
      implements RouteDescriptor {}

  /** Upstream path built from a template with {@code {param}} placeholders. */
  record Parameterized(
      String name,
      String pathTemplate,
      List<String> requiredParams,
      MarketPrecondition precondition)
      implements RouteDescriptor {

    public Parameterized {
      requiredParams = List.copyOf(requiredParams);
    }

    public String expand(Map<String, String> params) {
      String path = pathTemplate;
      for (String param : requiredParams) {
        String value = UriUtils.encodePathSegment(params.get(param), StandardCharsets.UTF_8);
        path = path.replace("{" + param + "}", value);
      }
      return path;
    }
  }

  /** Payload computed from several upstream calls. */
  record Composite(String name, Supplier<Object> fetch, MarketPrecondition precondition)
      implements RouteDescriptor {}
}
