package com.nepsegateway.marketgateway.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.nepsegateway.marketgateway.client.EndpointResponseCache;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Composite;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Parameterized;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Passthrough;
import com.nepsegateway.marketgateway.validation.StockValidator;
import com.nepsegateway.marketgateway.validation.ValidationFailureException;
import com.nepsegateway.marketgateway.validation.ValidationResult;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Resolves a route name plus parameters into a payload. Shared by the HTTP, WebSocket, queue and
 * tool-call bindings; rate limiting stays with the caller.
 */
@Service
public class RouteDispatcher {

  private final RouteRegistry registry;
  private final EndpointResponseCache cache;
  private final StockValidator validator;
  private final MarketStateService marketState;

  public RouteDispatcher(
      RouteRegistry registry,
      EndpointResponseCache cache,
      StockValidator validator,
      MarketStateService marketState) {
    this.registry = registry;
    this.cache = cache;
    this.validator = validator;
    this.marketState = marketState;
  }

  public Object dispatch(String routeName, Map<String, String> params) {
    RouteDescriptor route =
        registry.find(routeName).orElseThrow(() -> new UnknownRouteException(routeName));
    Map<String, String> resolved = resolveParams(route, params == null ? Map.of() : params);
    marketState.require(route);

    if (route instanceof Passthrough passthrough) {
      JsonNode payload = cache.fetch(passthrough.path());
      return passthrough.transform().apply(payload);
    }
    if (route instanceof Parameterized parameterized) {
      return cache.fetch(parameterized.expand(resolved));
    }
    if (route instanceof Composite composite) {
      return composite.fetch().get();
    }
    throw new IllegalStateException("Unsupported route type: " + route.getClass());
  }

  private Map<String, String> resolveParams(RouteDescriptor route, Map<String, String> params) {
    Map<String, String> resolved = new HashMap<>();
    for (String param : route.requiredParams()) {
      String value = params.get(param);
      if (value == null || value.isBlank()) {
        throw new MissingParameterException(route.name(), param);
      }
      if (RouteRegistry.SYMBOL.equals(param)) {
        ValidationResult result = validator.validateStockSymbol(value);
        if (!result.valid()) {
          throw new ValidationFailureException(param, result);
        }
        value = result.symbol();
      }
      resolved.put(param, value);
    }
    return resolved;
  }
}
