package org.hypertrace.core.cloudwatch.query.tsdb;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class AnnotationTsdbQuery implements TsdbQuery {
  public static final String TYPE = "annotationQuery";

  @NonNull String refId;
  long intervalMs;
  long maxDataPoints;
  long datasourceId;

  boolean prefixMatching;
  String region;
  String namespace;
  String metricName;
  @Singular Map<String, List<String>> dimensions;
  @Singular List<String> statistics;
  /** Null when no period applies, as for prefix matched alarms. */
  Integer period;
  String actionPrefix;
  String alarmNamePrefix;

  @Override
  public String getType() {
    return TYPE;
  }
}
