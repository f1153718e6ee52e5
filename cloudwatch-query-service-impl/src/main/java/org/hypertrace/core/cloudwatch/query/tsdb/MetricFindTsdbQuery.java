package org.hypertrace.core.cloudwatch.query.tsdb;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Metadata lookup. Only the parameters relevant to the {@code subtype} are set. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricFindTsdbQuery implements TsdbQuery {
  public static final String TYPE = "metricFindQuery";

  @NonNull String refId;
  long intervalMs;
  long maxDataPoints;
  long datasourceId;
  @NonNull String subtype;

  String region;
  String namespace;
  String metricName;
  String dimensionKey;
  Map<String, List<String>> dimensions;
  String instanceId;
  String attributeName;
  JsonNode filters;
  String resourceType;
  JsonNode tags;

  @Override
  public String getType() {
    return TYPE;
  }
}
