package org.hypertrace.core.cloudwatch.query;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.cloudwatch.query.annotation.CloudWatchAnnotationClient;
import org.hypertrace.core.cloudwatch.query.api.Annotation;
import org.hypertrace.core.cloudwatch.query.api.AnnotationDefinition;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;
import org.hypertrace.core.cloudwatch.query.api.DataSourceStatus;
import org.hypertrace.core.cloudwatch.query.api.DimensionValue;
import org.hypertrace.core.cloudwatch.query.api.MetricFindValue;
import org.hypertrace.core.cloudwatch.query.api.QueryOptions;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.api.TimeSeries;
import org.hypertrace.core.cloudwatch.query.metadata.CloudWatchMetadataClient;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRequestException;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRestClient;
import org.hypertrace.core.cloudwatch.query.tsdb.TimeSeriesTsdbQuery;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbRequest;

/**
 * Entry point of the CloudWatch datasource. Time series queries are translated and sent as a
 * single batch; metadata lookups and annotations are delegated to their own clients.
 */
@Singleton
@Slf4j
public class CloudWatchDataSource {
  static final String TEST_NAMESPACE = "AWS/Billing";
  static final String TEST_METRIC_NAME = "EstimatedCharges";
  static final String TEST_DIMENSION_KEY = "ServiceName";
  static final String TEST_SUCCESS_MESSAGE = "Data source is working";

  private final CloudWatchDataSourceConfig config;
  private final TemplateService templateService;
  private final CloudWatchQueryConverter queryConverter;
  private final CloudWatchRestClient restClient;
  private final CloudWatchResponseBuilder responseBuilder;
  private final CloudWatchMetadataClient metadataClient;
  private final CloudWatchAnnotationClient annotationClient;

  @Inject
  CloudWatchDataSource(
      CloudWatchDataSourceConfig config,
      TemplateService templateService,
      CloudWatchQueryConverter queryConverter,
      CloudWatchRestClient restClient,
      CloudWatchResponseBuilder responseBuilder,
      CloudWatchMetadataClient metadataClient,
      CloudWatchAnnotationClient annotationClient) {
    this.config = config;
    this.templateService = templateService;
    this.queryConverter = queryConverter;
    this.restClient = restClient;
    this.responseBuilder = responseBuilder;
    this.metadataClient = metadataClient;
    this.annotationClient = annotationClient;
  }

  /**
   * Runs the submittable targets of {@code options} as one batch. Translation errors, such as an
   * invalid statistic or period, fail the returned {@link Single} before anything is sent. When no
   * target is submittable the result is empty and no request is made.
   */
  public Single<List<TimeSeries>> query(QueryOptions options) {
    return Single.defer(
            () -> {
              List<TimeSeriesTsdbQuery> queries = queryConverter.convert(options);
              if (queries.isEmpty()) {
                return Single.just(List.<TimeSeries>of());
              }
              return restClient
                  .execute(TsdbRequest.forTimeRange(options.getRange(), queries))
                  .map(
                      response ->
                          responseBuilder.buildResponse(response, queries, options.getRange()));
            })
        .doOnError(this::logQueryError);
  }

  public Single<List<MetricFindValue>> metricFindQuery(String query) {
    return metadataClient.metricFindQuery(query);
  }

  public Single<List<Annotation>> annotationQuery(
      AnnotationDefinition annotation, TimeRange timeRange) {
    return annotationClient.annotationQuery(annotation, timeRange);
  }

  /** True when any of the region, namespace, metric name or dimensions references a variable. */
  public boolean targetContainsTemplate(CloudWatchQuery target) {
    return templateService.variableExists(target.getRegion())
        || templateService.variableExists(target.getNamespace())
        || templateService.variableExists(target.getMetricName())
        || target.getDimensions().entrySet().stream()
            .anyMatch(
                dimension ->
                    templateService.variableExists(dimension.getKey())
                        || dimensionContainsTemplate(dimension.getValue()));
  }

  /** Checks connectivity and credentials with a cheap billing dimension lookup. */
  public Single<DataSourceStatus> testDatasource() {
    return metadataClient
        .getDimensionValues(
            config.getDefaultRegion(),
            TEST_NAMESPACE,
            TEST_METRIC_NAME,
            TEST_DIMENSION_KEY,
            Map.of())
        .map(values -> DataSourceStatus.success(TEST_SUCCESS_MESSAGE));
  }

  public List<String> getStandardStatistics() {
    return config.getStandardStatistics();
  }

  public String getDefaultRegion() {
    return config.getDefaultRegion();
  }

  public String getActualRegion(String region) {
    return config.getActualRegion(region);
  }

  private boolean dimensionContainsTemplate(DimensionValue value) {
    if (value == null || (!value.isList() && value.getValue() == null)) {
      return false;
    }
    if (value.isList()) {
      return value.getValues().stream().anyMatch(templateService::variableExists);
    }
    return templateService.variableExists(value.getValue());
  }

  private void logQueryError(Throwable error) {
    if (error instanceof CloudWatchRequestException) {
      CloudWatchRequestException requestException = (CloudWatchRequestException) error;
      log.warn(
          "CloudWatch query failed with {} error: {}",
          requestException.getErrorType(),
          requestException.getError());
    } else {
      log.warn("CloudWatch query failed", error);
    }
  }
}
