package com.nepsegateway.marketgateway.transport.tool;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A callable tool. {@code rateLimitKey} is the route name or path whose category the call is
 * counted under.
 */
public record ToolDefinition(
    String name,
    String description,
    List<ToolArgument> arguments,
    String rateLimitKey,
    Function<Map<String, String>, Object> invoker) {

  public ToolDefinition {
    arguments = List.copyOf(arguments);
  }
}
