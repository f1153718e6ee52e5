package org.hypertrace.core.cloudwatch.query.api;

/** Supplies the currently selected dashboard time range, used by metadata lookups. */
public interface TimeRangeProvider {
  TimeRange getTimeRange();
}
