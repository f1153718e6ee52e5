package org.hypertrace.core.cloudwatch.query.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Alarm history annotation source, matched either by metric or by alarm name prefix. */
@Value
@Builder
public class AnnotationDefinition {
  @Builder.Default String region = "";
  @Builder.Default String namespace = "";
  @Builder.Default String metricName = "";
  @Singular Map<String, DimensionValue> dimensions;
  @Singular List<String> statistics;
  @Builder.Default String period = "";
  boolean prefixMatching;
  @Builder.Default String actionPrefix = "";
  @Builder.Default String alarmNamePrefix = "";
}
