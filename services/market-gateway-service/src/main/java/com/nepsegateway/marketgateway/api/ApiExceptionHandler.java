package com.nepsegateway.marketgateway.api;

import com.nepsegateway.marketgateway.client.UpstreamUnavailableException;
import com.nepsegateway.marketgateway.common.ratelimit.RateLimitExceededException;
import com.nepsegateway.marketgateway.common.web.ErrorResponse;
import com.nepsegateway.marketgateway.common.web.GatewayErrorMapper;
import com.nepsegateway.marketgateway.routing.MarketStateException;
import com.nepsegateway.marketgateway.routing.MissingParameterException;
import com.nepsegateway.marketgateway.routing.UnknownRouteException;
import com.nepsegateway.marketgateway.validation.ValidationFailureException;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private final GatewayErrorMapper errorMapper;
  private final Clock clock;

  public ApiExceptionHandler(GatewayErrorMapper errorMapper, Clock clock) {
    this.errorMapper = errorMapper;
    this.clock = clock;
  }

  @ExceptionHandler({
    UpstreamUnavailableException.class,
    ValidationFailureException.class,
    MarketStateException.class,
    UnknownRouteException.class,
    MissingParameterException.class
  })
  public ResponseEntity<ErrorResponse> handleGatewayException(RuntimeException ex) {
    return ResponseEntity.status(errorMapper.statusOf(ex)).body(errorMapper.toResponse(ex));
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex) {
    return ResponseEntity.status(errorMapper.statusOf(ex))
        .header(
            HttpHeaders.RETRY_AFTER,
            String.valueOf(ex.decision().retryAfterSeconds(clock.instant())))
        .body(errorMapper.toResponse(ex));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(errorMapper.error("INVALID_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    if (ex instanceof org.springframework.web.ErrorResponse springError) {
      HttpStatusCode status = springError.getStatusCode();
      if (status.is4xxClientError()) {
        return ResponseEntity.status(status)
            .body(errorMapper.error("REQUEST_REJECTED", springError.getBody().getDetail()));
      }
    }
    return ResponseEntity.status(errorMapper.statusOf(ex)).body(errorMapper.toResponse(ex));
  }
}
