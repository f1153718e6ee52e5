package org.hypertrace.core.cloudwatch.query.validation;

import lombok.Getter;

@Getter
public class InvalidStatisticException extends IllegalArgumentException {
  private final String statistic;

  InvalidStatisticException(String statistic) {
    super("Invalid extended statistics");
    this.statistic = statistic;
  }
}
