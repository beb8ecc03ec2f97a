package com.nepsegateway.marketgateway.transport.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitDecision;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.common.ratelimit.SlidingWindowRateLimiter;
import com.nepsegateway.marketgateway.common.web.ClientAddress;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.routing.RouteParams;
import com.nepsegateway.marketgateway.transport.tool.JsonRpcDtos.Response;
import com.nepsegateway.marketgateway.transport.tool.JsonRpcDtos.RpcException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agent-tool binding: JSON-RPC 2.0 over a single POST endpoint. Each request is admitted once,
 * under the backing route's category for {@code tools/call} and under {@code /mcp} otherwise.
 */
@RestController
@Slf4j
public class McpController {

  static final String PROTOCOL_VERSION = "2025-03-26";
  static final String SERVER_NAME = "nepse-market-gateway";
  static final String SERVER_VERSION = "0.1.0";
  private static final String RATE_LIMIT_KEY = "/mcp";

  private final ToolRegistry registry;
  private final SlidingWindowRateLimiter rateLimiter;
  private final GatewayErrorMapper errorMapper;
  private final ObjectMapper objectMapper;

  public McpController(
      ToolRegistry registry,
      SlidingWindowRateLimiter rateLimiter,
      GatewayErrorMapper errorMapper,
      ObjectMapper objectMapper) {
    this.registry = registry;
    this.rateLimiter = rateLimiter;
    this.errorMapper = errorMapper;
    this.objectMapper = objectMapper;
  }

  @PostMapping(path = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Response> handle(
      @RequestBody(required = false) String body, HttpServletRequest httpRequest) {
    String clientId = ClientAddress.resolve(httpRequest);
    JsonNode request;
    try {
      request = body == null ? null : objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      return malformed(clientId, null, JsonRpcDtos.PARSE_ERROR, "Parse error");
    }
    if (request == null || !request.isObject()) {
      return malformed(
          clientId, null, JsonRpcDtos.INVALID_REQUEST, "Request must be a JSON object");
    }

    JsonNode id = request.get("id");
    String method = request.path("method").asText(null);
    if (!JsonRpcDtos.VERSION.equals(request.path("jsonrpc").asText()) || method == null) {
      return malformed(clientId, id, JsonRpcDtos.INVALID_REQUEST, "Invalid JSON-RPC 2.0 request");
    }
    JsonNode params = request.path("params");

    Optional<ToolDefinition> tool =
        "tools/call".equals(method)
            ? registry.tool(params.path("name").asText(null))
            : Optional.empty();
    String rateLimitKey = tool.map(ToolDefinition::rateLimitKey).orElse(RATE_LIMIT_KEY);
    RateLimitDecision decision = rateLimiter.admit(clientId, rateLimitKey);

    if (id == null) {
      // Notification: nothing to answer.
      return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }
    if (!decision.allowed()) {
      RateLimitExceededException rejected = new RateLimitExceededException(decision);
      if (tool.isPresent()) {
        return ResponseEntity.ok(Response.result(id, toolError(rejected)));
      }
      return ResponseEntity.ok(rateLimited(id, rejected));
    }

    try {
      return ResponseEntity.ok(Response.result(id, dispatch(method, params, tool)));
    } catch (RpcException ex) {
      return ResponseEntity.ok(Response.error(id, ex.code(), ex.getMessage()));
    }
  }

  /** Unparseable or invalid envelopes still count against the {@code /mcp} quota. */
  private ResponseEntity<Response> malformed(
      String clientId, JsonNode id, int code, String message) {
    RateLimitDecision decision = rateLimiter.admit(clientId, RATE_LIMIT_KEY);
    if (!decision.allowed()) {
      return ResponseEntity.ok(rateLimited(id, new RateLimitExceededException(decision)));
    }
    return ResponseEntity.ok(Response.error(id, code, message));
  }

  private Response rateLimited(JsonNode id, RateLimitExceededException rejected) {
    return Response.error(
        id, JsonRpcDtos.SERVER_ERROR, rejected.getMessage(), errorMapper.toResponse(rejected));
  }

  private Object dispatch(String method, JsonNode params, Optional<ToolDefinition> tool) {
    switch (method) {
      case "initialize":
        return initialize(params);
      case "ping":
        return Map.of();
      case "tools/list":
        return Map.of(
            "tools", registry.tools().stream().map(McpController::describeTool).toList());
      case "tools/call":
        ToolDefinition definition =
            tool.orElseThrow(
                () ->
                    new RpcException(
                        JsonRpcDtos.INVALID_PARAMS,
                        "Unknown tool: " + params.path("name").asText("")));
        return callTool(definition, RouteParams.fromJson(params.get("arguments")));
      case "prompts/list":
        return Map.of(
            "prompts", registry.prompts().stream().map(McpController::describePrompt).toList());
      case "prompts/get":
        return getPrompt(params);
      default:
        throw new RpcException(JsonRpcDtos.METHOD_NOT_FOUND, "Method not found: " + method);
    }
  }

  private Map<String, Object> initialize(JsonNode params) {
    String requested = params.path("protocolVersion").asText(null);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("protocolVersion", requested != null ? requested : PROTOCOL_VERSION);
    result.put(
        "capabilities",
        Map.of(
            "tools", Map.of("listChanged", false),
            "prompts", Map.of("listChanged", false)));
    result.put("serverInfo", Map.of("name", SERVER_NAME, "version", SERVER_VERSION));
    return result;
  }

  private Map<String, Object> callTool(ToolDefinition tool, Map<String, String> arguments) {
    try {
      Object data = tool.invoker().apply(arguments);
      return Map.of("content", List.of(textContent(data)), "isError", false);
    } catch (RuntimeException ex) {
      log.warn("Tool {} failed: {}", tool.name(), ex.getMessage());
      return toolError(ex);
    }
  }

  private Map<String, Object> toolError(RuntimeException ex) {
    return Map.of("content", List.of(textContent(errorMapper.toResponse(ex))), "isError", true);
  }

  private Map<String, Object> getPrompt(JsonNode params) {
    String name = params.path("name").asText(null);
    PromptDefinition prompt =
        registry
            .prompt(name)
            .orElseThrow(
                () -> new RpcException(JsonRpcDtos.INVALID_PARAMS, "Unknown prompt: " + name));
    Map<String, String> arguments = RouteParams.fromJson(params.get("arguments"));
    for (ToolArgument argument : prompt.arguments()) {
      String value = arguments.get(argument.name());
      if (argument.required() && (value == null || value.isBlank())) {
        throw new RpcException(
            JsonRpcDtos.INVALID_PARAMS, "Missing required argument: " + argument.name());
      }
    }
    Map<String, Object> message =
        Map.of(
            "role",
            "user",
            "content",
            Map.of("type", "text", "text", prompt.template().apply(arguments)));
    return Map.of("description", prompt.description(), "messages", List.of(message));
  }

  private Map<String, Object> textContent(Object data) {
    try {
      return Map.of("type", "text", "text", objectMapper.writeValueAsString(data));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Tool result is not serializable", ex);
    }
  }

  private static Map<String, Object> describeTool(ToolDefinition tool) {
    return Map.of(
        "name", tool.name(),
        "description", tool.description(),
        "inputSchema", inputSchema(tool.arguments()));
  }

  private static Map<String, Object> describePrompt(PromptDefinition prompt) {
    List<Map<String, Object>> arguments = new ArrayList<>();
    for (ToolArgument argument : prompt.arguments()) {
      arguments.add(
          Map.of(
              "name", argument.name(),
              "description", argument.description(),
              "required", argument.required()));
    }
    return Map.of(
        "name", prompt.name(), "description", prompt.description(), "arguments", arguments);
  }

  private static Map<String, Object> inputSchema(List<ToolArgument> arguments) {
    Map<String, Object> properties = new LinkedHashMap<>();
    List<String> required = new ArrayList<>();
    for (ToolArgument argument : arguments) {
      properties.put(
          argument.name(), Map.of("type", "string", "description", argument.description()));
      if (argument.required()) {
        required.add(argument.name());
      }
    }
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", properties);
    schema.put("required", required);
    return schema;
  }
}
