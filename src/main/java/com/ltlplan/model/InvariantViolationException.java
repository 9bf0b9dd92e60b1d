package com.ltlplan.model;

public class InvariantViolationException extends RuntimeException {
  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
