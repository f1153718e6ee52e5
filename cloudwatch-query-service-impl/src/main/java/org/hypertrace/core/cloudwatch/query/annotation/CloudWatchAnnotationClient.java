package org.hypertrace.core.cloudwatch.query.annotation;

import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.cloudwatch.query.CloudWatchDataSourceConfig;
import org.hypertrace.core.cloudwatch.query.DimensionNormalizer;
import org.hypertrace.core.cloudwatch.query.api.Annotation;
import org.hypertrace.core.cloudwatch.query.api.AnnotationDefinition;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.tsdb.AnnotationTsdbQuery;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRestClient;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbRequest;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse.TsdbQueryResult;

/** Fetches alarm history for an annotation definition, one alarm state change per annotation. */
public class CloudWatchAnnotationClient {
  static final String ANNOTATION_QUERY_REF_ID = "annotationQuery";

  private static final String DEFAULT_PERIOD = "300";
  private static final long DUMMY_INTERVAL_MS = 1;
  private static final long DUMMY_MAX_DATA_POINTS = 1;

  private final CloudWatchDataSourceConfig config;
  private final CloudWatchRestClient restClient;
  private final TemplateService templateService;
  private final DimensionNormalizer dimensionNormalizer;

  @Inject
  public CloudWatchAnnotationClient(
      CloudWatchDataSourceConfig config,
      CloudWatchRestClient restClient,
      TemplateService templateService,
      DimensionNormalizer dimensionNormalizer) {
    this.config = config;
    this.restClient = restClient;
    this.templateService = templateService;
    this.dimensionNormalizer = dimensionNormalizer;
  }

  public Single<List<Annotation>> annotationQuery(
      AnnotationDefinition annotation, TimeRange timeRange) {
    return Single.defer(
        () ->
            restClient
                .execute(
                    TsdbRequest.forTimeRange(timeRange, List.of(buildQuery(annotation))))
                .map(response -> toAnnotations(response, annotation)));
  }

  AnnotationTsdbQuery buildQuery(AnnotationDefinition annotation) {
    String period = annotation.getPeriod();
    if (period.isEmpty() && !annotation.isPrefixMatching()) {
      period = DEFAULT_PERIOD;
    }
    return AnnotationTsdbQuery.builder()
        .refId(ANNOTATION_QUERY_REF_ID)
        .intervalMs(DUMMY_INTERVAL_MS)
        .maxDataPoints(DUMMY_MAX_DATA_POINTS)
        .datasourceId(config.getId())
        .prefixMatching(annotation.isPrefixMatching())
        .region(replace(config.getActualRegion(annotation.getRegion())))
        .namespace(replace(annotation.getNamespace()))
        .metricName(replace(annotation.getMetricName()))
        .dimensions(dimensionNormalizer.normalize(annotation.getDimensions(), ScopedVars.empty()))
        .statistics(
            annotation.getStatistics().stream()
                .map(this::replace)
                .collect(Collectors.toUnmodifiableList()))
        .period(parseLeadingInteger(period))
        .actionPrefix(annotation.getActionPrefix())
        .alarmNamePrefix(annotation.getAlarmNamePrefix())
        .build();
  }

  private List<Annotation> toAnnotations(TsdbResponse response, AnnotationDefinition annotation) {
    TsdbQueryResult result = response.getResults().get(ANNOTATION_QUERY_REF_ID);
    if (result == null || result.getTables().isEmpty()) {
      return List.of();
    }
    return result.getTables().get(0).getRows().stream()
        .map(
            row ->
                Annotation.builder()
                    .annotation(annotation)
                    .time(parseTime(cell(row, 0)))
                    .title(cell(row, 1))
                    .tag(cell(row, 2))
                    .text(cell(row, 3))
                    .build())
        .collect(Collectors.toUnmodifiableList());
  }

  /** Leading digits of {@code value} as an integer, null when there are none. */
  static Integer parseLeadingInteger(String value) {
    String trimmed = value.trim();
    int end = 0;
    if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) {
      end++;
    }
    int digitsStart = end;
    while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
      end++;
    }
    if (end == digitsStart) {
      return null;
    }
    try {
      return Integer.valueOf(trimmed.substring(0, end));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Annotation period is out of range: " + value, e);
    }
  }

  private static Instant parseTime(String time) {
    if (time == null) {
      return null;
    }
    try {
      return Instant.parse(time);
    } catch (DateTimeParseException e) {
      // some backends send epoch millis instead of an iso timestamp
      return Instant.ofEpochMilli(Long.parseLong(time));
    }
  }

  private static String cell(List<String> row, int index) {
    return index < row.size() ? row.get(index) : null;
  }

  private String replace(String target) {
    return templateService.replace(target, ScopedVars.empty());
  }
}
