package org.hypertrace.core.cloudwatch.query.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single user authored CloudWatch query, either a metric stat lookup (region, namespace, metric
 * name, dimensions and statistics) or a free-form metric math / search expression. Every optional
 * field is defaulted by the builder.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CloudWatchQuery {
  @Builder.Default String refId = "";

  @Builder.Default String id = "";

  @Builder.Default String region = "";

  @Builder.Default String namespace = "";

  @Builder.Default String metricName = "";

  @Singular Map<String, DimensionValue> dimensions;

  @Singular List<String> statistics;

  /** Literal seconds, an interval such as {@code 5m}, or a template variable. Empty for auto. */
  @Builder.Default String period = "";

  @Builder.Default String expression = "";

  boolean highResolution;

  boolean hide;

  @Builder.Default String alias = "";

  @Builder.Default boolean matchExact = true;
}
