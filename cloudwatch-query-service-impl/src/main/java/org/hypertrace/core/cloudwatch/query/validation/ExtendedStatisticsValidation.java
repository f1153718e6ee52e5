package org.hypertrace.core.cloudwatch.query.validation;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Percentile statistics must look like {@code p90} or {@code p99.99}. Standard statistic names are
 * not checked here, the backend rejects unknown names itself.
 */
public class ExtendedStatisticsValidation {
  private static final String EXTENDED_STATISTIC_PREFIX = "p";
  private static final Pattern EXTENDED_STATISTIC_PATTERN =
      Pattern.compile("^p\\d{2}(?:\\.\\d{1,2})?$");

  public void validate(List<String> statistics) {
    for (String statistic : statistics) {
      if (isInvalidExtendedStatistic(statistic)) {
        throw new InvalidStatisticException(statistic);
      }
    }
  }

  private boolean isInvalidExtendedStatistic(String statistic) {
    return statistic.startsWith(EXTENDED_STATISTIC_PREFIX)
        && !EXTENDED_STATISTIC_PATTERN.matcher(statistic).matches();
  }
}
