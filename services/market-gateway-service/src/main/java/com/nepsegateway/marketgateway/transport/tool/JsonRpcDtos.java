package com.nepsegateway.marketgateway.transport.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

public final class JsonRpcDtos {
  private JsonRpcDtos() {}

  public static final String VERSION = "2.0";

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int SERVER_ERROR = -32000;

  public record Response(
      String jsonrpc,
      JsonNode id,
      @JsonInclude(JsonInclude.Include.NON_NULL) Object result,
      @JsonInclude(JsonInclude.Include.NON_NULL) RpcError error) {

    public static Response result(JsonNode id, Object result) {
      return new Response(VERSION, id, result, null);
    }

    public static Response error(JsonNode id, int code, String message) {
      return new Response(VERSION, id, null, new RpcError(code, message, null));
    }

    public static Response error(JsonNode id, int code, String message, Object data) {
      return new Response(VERSION, id, null, new RpcError(code, message, data));
    }
  }

  public record RpcError(
      int code, String message, @JsonInclude(JsonInclude.Include.NON_NULL) Object data) {}

  /** Thrown while handling a request; becomes a JSON-RPC error object. */
  public static class RpcException extends RuntimeException {
    private final int code;

    public RpcException(int code, String message) {
      super(message);
      this.code = code;
    }

    public int code() {
      return code;
    }
  }
}
