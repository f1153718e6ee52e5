package org.hypertrace.core.cloudwatch.query.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.cloudwatch.query.CloudWatchDataSourceConfig;
import org.hypertrace.core.cloudwatch.query.DimensionNormalizer;
import org.hypertrace.core.cloudwatch.query.api.DimensionValue;
import org.hypertrace.core.cloudwatch.query.api.MetricFindValue;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TimeRangeProvider;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRestClient;
import org.hypertrace.core.cloudwatch.query.tsdb.MetricFindTsdbQuery;
import org.hypertrace.core.cloudwatch.query.tsdb.MetricFindTsdbQuery.MetricFindTsdbQueryBuilder;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbRequest;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse.TsdbQueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookups used by the query editor and by template variables: regions, namespaces, metric names,
 * dimension keys and values, and a few resource identifiers. Each lookup is a single query batch
 * whose answer is a two column table of text and value.
 */
public class CloudWatchMetadataClient {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchMetadataClient.class);

  static final String METRIC_FIND_QUERY_REF_ID = "metricFindQuery";

  private static final long DUMMY_INTERVAL_MS = 1;
  private static final long DUMMY_MAX_DATA_POINTS = 1;
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, DimensionValue>> DIMENSIONS_TYPE =
      new TypeReference<>() {};

  private final CloudWatchDataSourceConfig config;
  private final CloudWatchRestClient restClient;
  private final TemplateService templateService;
  private final DimensionNormalizer dimensionNormalizer;
  private final TimeRangeProvider timeRangeProvider;
  private final MetricFindQueryParser queryParser;

  @Inject
  public CloudWatchMetadataClient(
      CloudWatchDataSourceConfig config,
      CloudWatchRestClient restClient,
      TemplateService templateService,
      DimensionNormalizer dimensionNormalizer,
      TimeRangeProvider timeRangeProvider) {
    this.config = config;
    this.restClient = restClient;
    this.templateService = templateService;
    this.dimensionNormalizer = dimensionNormalizer;
    this.timeRangeProvider = timeRangeProvider;
    this.queryParser = new MetricFindQueryParser();
  }

  public Single<List<MetricFindValue>> getRegions() {
    return doMetricQueryRequest("regions", MetricFindTsdbQuery.builder());
  }

  public Single<List<MetricFindValue>> getNamespaces() {
    return doMetricQueryRequest("namespaces", MetricFindTsdbQuery.builder());
  }

  public Single<List<MetricFindValue>> getMetrics(String namespace, String region) {
    return doMetricQueryRequest(
        "metrics",
        MetricFindTsdbQuery.builder().region(resolveRegion(region)).namespace(replace(namespace)));
  }

  public Single<List<MetricFindValue>> getDimensionKeys(String namespace, String region) {
    return doMetricQueryRequest(
        "dimension_keys",
        MetricFindTsdbQuery.builder().region(resolveRegion(region)).namespace(replace(namespace)));
  }

  public Single<List<MetricFindValue>> getDimensionValues(
      String region,
      String namespace,
      String metricName,
      String dimensionKey,
      Map<String, DimensionValue> filterDimensions) {
    return doMetricQueryRequest(
        "dimension_values",
        MetricFindTsdbQuery.builder()
            .region(resolveRegion(region))
            .namespace(replace(namespace))
            .metricName(replace(metricName))
            .dimensionKey(replace(dimensionKey))
            .dimensions(dimensionNormalizer.normalize(filterDimensions, ScopedVars.empty())));
  }

  public Single<List<MetricFindValue>> getEbsVolumeIds(String region, String instanceId) {
    return doMetricQueryRequest(
        "ebs_volume_ids",
        MetricFindTsdbQuery.builder()
            .region(resolveRegion(region))
            .instanceId(replace(instanceId)));
  }

  public Single<List<MetricFindValue>> getEc2InstanceAttribute(
      String region, String attributeName, JsonNode filters) {
    return doMetricQueryRequest(
        "ec2_instance_attribute",
        MetricFindTsdbQuery.builder()
            .region(resolveRegion(region))
            .attributeName(replace(attributeName))
            .filters(filters));
  }

  public Single<List<MetricFindValue>> getResourceArns(
      String region, String resourceType, JsonNode tags) {
    return doMetricQueryRequest(
        "resource_arns",
        MetricFindTsdbQuery.builder()
            .region(resolveRegion(region))
            .resourceType(replace(resourceType))
            .tags(tags));
  }

  /**
   * Runs a free-form variable query. Queries that do not match any lookup yield an empty list,
   * while malformed inline json fails the returned {@link Single}.
   */
  public Single<List<MetricFindValue>> metricFindQuery(String query) {
    return queryParser
        .parse(query)
        .map(parsed -> Single.defer(() -> execute(parsed)))
        .orElseGet(
            () -> {
              LOG.debug("Variable query '{}' does not match any lookup", query);
              return Single.just(List.of());
            });
  }

  private Single<List<MetricFindValue>> execute(MetricFindQuery query) throws Exception {
    switch (query.getType()) {
      case REGIONS:
        return getRegions();
      case NAMESPACES:
        return getNamespaces();
      case METRICS:
        return getMetrics(query.getArgument(0), query.getOptionalArgument(1));
      case DIMENSION_KEYS:
        return getDimensionKeys(query.getArgument(0), query.getOptionalArgument(1));
      case DIMENSION_VALUES:
        String filter = query.getOptionalArgument(4);
        Map<String, DimensionValue> filterDimensions =
            filter.isEmpty() ? Map.of() : OBJECT_MAPPER.readValue(replace(filter), DIMENSIONS_TYPE);
        return getDimensionValues(
            query.getArgument(0),
            query.getArgument(1),
            query.getArgument(2),
            query.getArgument(3),
            filterDimensions);
      case EBS_VOLUME_IDS:
        return getEbsVolumeIds(query.getArgument(0), query.getArgument(1));
      case EC2_INSTANCE_ATTRIBUTE:
        return getEc2InstanceAttribute(
            query.getArgument(0), query.getArgument(1), parseJson(query.getArgument(2)));
      case RESOURCE_ARNS:
        return getResourceArns(
            query.getArgument(0), query.getArgument(1), parseJson(query.getArgument(2)));
      default:
        throw new UnsupportedOperationException("Unsupported lookup: " + query.getType());
    }
  }

  private Single<List<MetricFindValue>> doMetricQueryRequest(
      String subtype, MetricFindTsdbQueryBuilder parameters) {
    return Single.defer(
        () -> {
          MetricFindTsdbQuery query =
              parameters
                  .refId(METRIC_FIND_QUERY_REF_ID)
                  .intervalMs(DUMMY_INTERVAL_MS)
                  .maxDataPoints(DUMMY_MAX_DATA_POINTS)
                  .datasourceId(config.getId())
                  .subtype(subtype)
                  .build();
          return restClient
              .execute(TsdbRequest.forTimeRange(timeRangeProvider.getTimeRange(), List.of(query)))
              .map(this::transformSuggestData);
        });
  }

  private List<MetricFindValue> transformSuggestData(TsdbResponse response) {
    TsdbQueryResult result = response.getResults().get(METRIC_FIND_QUERY_REF_ID);
    if (result == null || result.getTables().isEmpty()) {
      return List.of();
    }
    return result.getTables().get(0).getRows().stream()
        .filter(row -> row != null && !row.isEmpty())
        .map(row -> MetricFindValue.of(row.get(0), row.size() > 1 ? row.get(1) : row.get(0)))
        .collect(Collectors.toUnmodifiableList());
  }

  private JsonNode parseJson(String json) throws Exception {
    return OBJECT_MAPPER.readTree(replace(json));
  }

  private String resolveRegion(String region) {
    return replace(config.getActualRegion(region));
  }

  private String replace(String target) {
    return templateService.replace(target, ScopedVars.empty());
  }
}
