package org.hypertrace.core.cloudwatch.query.tsdb;

/** Fields shared by every query placed in a {@link TsdbRequest}. */
public interface TsdbQuery {
  String getRefId();

  long getIntervalMs();

  long getMaxDataPoints();

  long getDatasourceId();

  String getType();
}
