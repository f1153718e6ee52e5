package org.hypertrace.core.cloudwatch.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.cloudwatch.query.tsdb.TimeSeriesTsdbQuery;

/**
 * Builds a deep link which opens the metrics of a query in the CloudWatch console. The graph
 * definition travels url encoded in the fragment.
 */
class CloudWatchConsoleUrlBuilder {
  private static final String CONSOLE_URL_TEMPLATE =
      "https://%s.console.aws.amazon.com/cloudwatch/deeplink.js?region=%s#metricsV2:graph=%s";

  // same escaping as javascript's encodeURIComponent
  private static final Escaper URI_COMPONENT_ESCAPER = new PercentEscaper("-_.!~*'()", false);
  private static final DateTimeFormatter ISO_MILLIS_FORMATTER =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  String buildConsoleUrl(
      TimeSeriesTsdbQuery query,
      Instant start,
      Instant end,
      String title,
      List<String> searchExpressions) {
    Map<String, Object> graph = new LinkedHashMap<>();
    graph.put("view", "timeSeries");
    graph.put("stacked", false);
    graph.put("title", title);
    graph.put("start", ISO_MILLIS_FORMATTER.format(start));
    graph.put("end", ISO_MILLIS_FORMATTER.format(end));
    graph.put("region", query.getRegion());
    graph.put(
        "metrics",
        searchExpressions != null && !searchExpressions.isEmpty()
            ? buildSearchExpressionMetrics(searchExpressions)
            : buildMetricStatMetrics(query));

    return String.format(
        CONSOLE_URL_TEMPLATE,
        query.getRegion(),
        query.getRegion(),
        URI_COMPONENT_ESCAPER.escape(toJson(graph)));
  }

  private List<Object> buildSearchExpressionMetrics(List<String> searchExpressions) {
    return searchExpressions.stream()
        .map(expression -> Map.of("expression", expression))
        .collect(Collectors.toList());
  }

  /** One {@code [namespace, metric, dimKey, dimValue, ..., {stat, period}]} entry per statistic. */
  private List<Object> buildMetricStatMetrics(TimeSeriesTsdbQuery query) {
    List<Object> metrics = new ArrayList<>();
    for (String statistic : query.getStatistics()) {
      List<Object> metric = new ArrayList<>();
      metric.add(query.getNamespace());
      metric.add(query.getMetricName());
      query
          .getDimensions()
          .forEach(
              (key, values) -> {
                metric.add(key);
                metric.add(values.isEmpty() ? null : values.get(0));
              });
      Map<String, Object> statOptions = new LinkedHashMap<>();
      statOptions.put("stat", statistic);
      statOptions.put("period", query.getPeriod());
      metric.add(statOptions);
      metrics.add(metric);
    }
    return metrics;
  }

  private String toJson(Map<String, Object> graph) {
    try {
      return OBJECT_MAPPER.writeValueAsString(graph);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }
}
