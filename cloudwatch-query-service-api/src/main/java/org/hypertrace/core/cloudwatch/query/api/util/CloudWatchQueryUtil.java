package org.hypertrace.core.cloudwatch.query.api.util;

import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;

/** Utility methods to inspect a {@link CloudWatchQuery} before it gets submitted. */
public class CloudWatchQueryUtil {

  private CloudWatchQueryUtil() {}

  public static boolean isMetricStatQuery(CloudWatchQuery query) {
    return StringUtils.isNotEmpty(query.getRegion())
        && StringUtils.isNotEmpty(query.getNamespace())
        && StringUtils.isNotEmpty(query.getMetricName())
        && !query.getStatistics().isEmpty();
  }

  public static boolean hasExpression(CloudWatchQuery query) {
    return StringUtils.isNotEmpty(query.getExpression());
  }

  /**
   * Hidden queries without an id are dropped, as are queries which neither fully specify a metric
   * nor carry an expression.
   */
  public static boolean isSubmittable(CloudWatchQuery query) {
    return (StringUtils.isNotEmpty(query.getId()) || !query.isHide())
        && (isMetricStatQuery(query) || hasExpression(query));
  }
}
