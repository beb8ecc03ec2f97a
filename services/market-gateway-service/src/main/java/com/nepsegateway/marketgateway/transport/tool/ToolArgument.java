package com.nepsegateway.marketgateway.transport.tool;

public record ToolArgument(String name, String description, boolean required) {

  static ToolArgument required(String name, String description) {
    return new ToolArgument(name, description, true);
  }
}
