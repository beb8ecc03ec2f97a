package com.nepsegateway.marketgateway.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.nepsegateway.marketgateway.routing.RouteDescriptor.Parameterized;
import com.nepsegateway.marketgateway.routing.RouteDescriptor.Passthrough;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RouteRegistryTest {

  private final RouteRegistry registry = new RouteRegistry(mock(MarketOverviewAggregator.class));

  @Test
  void routeNamesAreUniqueAndCaseSensitive() {
    assertThat(registry.all()).extracting(RouteDescriptor::name).doesNotHaveDuplicates();
    assertThat(registry.find("Summary")).isPresent();
    assertThat(registry.find("summary")).isEmpty();
    assertThat(registry.find(null)).isEmpty();
  }

  @Test
  void marketStatePreconditions() {
    assertThat(precondition("LiveMarket")).isEqualTo(MarketPrecondition.OPEN);
    assertThat(precondition("SupplyDemand")).isEqualTo(MarketPrecondition.OPEN);
    assertThat(precondition("MarketDepth")).isEqualTo(MarketPrecondition.OPEN);
    assertThat(precondition("Floorsheet")).isEqualTo(MarketPrecondition.CLOSED);
    assertThat(precondition("FloorsheetOf")).isEqualTo(MarketPrecondition.CLOSED);
    assertThat(precondition("TopGainers")).isEqualTo(MarketPrecondition.NONE);
  }

  @Test
  void indexGraphRoutesMapToSlugPaths() {
    List<RouteDescriptor> graphs =
        registry.all().stream()
            .filter(route -> route.name().startsWith("Daily") && route instanceof Passthrough)
            .toList();

    assertThat(graphs).hasSize(17);
    Passthrough nepse = (Passthrough) registry.find("DailyNepseIndexGraph").orElseThrow();
    assertThat(nepse.path()).isEqualTo("/graph/index/nepse");
  }

  @Test
  void symbolRoutesEncodeTheirParameter() {
    Parameterized route = (Parameterized) registry.find("FloorsheetOf").orElseThrow();

    assertThat(route.requiredParams()).containsExactly(RouteRegistry.SYMBOL);
    assertThat(route.expand(Map.of("symbol", "NIC A/B"))).isEqualTo("/floorsheet/NIC%20A%2FB");
  }

  private MarketPrecondition precondition(String name) {
    return registry.find(name).orElseThrow().precondition();
  }
}
