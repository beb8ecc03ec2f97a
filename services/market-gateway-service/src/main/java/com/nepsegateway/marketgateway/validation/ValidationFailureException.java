package com.nepsegateway.marketgateway.validation;

/** A route parameter named a symbol or index that does not exist. */
public class ValidationFailureException extends RuntimeException {
  private final String parameter;
  private final ValidationResult result;

  public ValidationFailureException(String parameter, ValidationResult result) {
    super(result.error());
    this.parameter = parameter;
    this.result = result;
  }

  public String parameter() {
    return parameter;
  }

  public ValidationResult result() {
    return result;
  }
}
