package com.nepsegateway.marketgateway.transport.tool;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Canned user prompt; {@code template} renders the message text from the arguments. */
public record PromptDefinition(
    String name,
    String description,
    List<ToolArgument> arguments,
    Function<Map<String, String>, String> template) {

  public PromptDefinition {
    arguments = List.copyOf(arguments);
  }
}
