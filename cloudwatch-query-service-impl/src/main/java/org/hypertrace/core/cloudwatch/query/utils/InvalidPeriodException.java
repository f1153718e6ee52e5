package org.hypertrace.core.cloudwatch.query.utils;

public class InvalidPeriodException extends IllegalArgumentException {

  public InvalidPeriodException(String message) {
    super(message);
  }

  public InvalidPeriodException(String message, Throwable cause) {
    super(message, cause);
  }
}
