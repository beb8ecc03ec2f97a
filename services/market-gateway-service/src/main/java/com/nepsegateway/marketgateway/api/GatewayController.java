package com.nepsegateway.marketgateway.api;

import com.nepsegateway.marketgateway.dto.HealthResponse;
import com.nepsegateway.marketgateway.routing.RouteDescriptor;
import com.nepsegateway.marketgateway.routing.RouteDispatcher;
import com.nepsegateway.marketgateway.routing.RouteRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** HTTP binding of the route table: {@code GET /<RouteName>?param=value}. */
@RestController
public class GatewayController {

  private final RouteDispatcher dispatcher;
  private final RouteRegistry registry;

  public GatewayController(RouteDispatcher dispatcher, RouteRegistry registry) {
    this.dispatcher = dispatcher;
    this.registry = registry;
  }

  @GetMapping("/")
  public ResponseEntity<Map<String, String>> index() {
    Map<String, String> routes = new LinkedHashMap<>();
    routes.put("Health", "/health");
    for (RouteDescriptor route : registry.all()) {
      routes.put(route.name(), "/" + route.name());
    }
    return CachedResponses.ok(routes);
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    return CachedResponses.ok(HealthResponse.healthy());
  }

  @GetMapping("/{route}")
  public ResponseEntity<Object> route(
      @PathVariable String route, @RequestParam Map<String, String> params) {
    return CachedResponses.ok(dispatcher.dispatch(route, params));
  }
}
