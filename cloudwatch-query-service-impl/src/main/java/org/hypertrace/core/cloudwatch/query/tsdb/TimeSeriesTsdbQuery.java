package org.hypertrace.core.cloudwatch.query.tsdb;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A fully resolved CloudWatch query, ready to be submitted as part of a batch. */
@Value
@Builder
public class TimeSeriesTsdbQuery implements TsdbQuery {
  public static final String TYPE = "timeSeriesQuery";

  @NonNull String refId;
  long intervalMs;
  long maxDataPoints;
  long datasourceId;

  String id;
  String region;
  String namespace;
  String metricName;
  @Singular Map<String, List<String>> dimensions;
  @Singular List<String> statistics;
  String period;
  String expression;
  boolean highResolution;
  boolean hide;
  String alias;
  boolean matchExact;

  @Override
  public String getType() {
    return TYPE;
  }
}
