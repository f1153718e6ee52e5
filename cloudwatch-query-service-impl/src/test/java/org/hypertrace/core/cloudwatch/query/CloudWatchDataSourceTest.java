package org.hypertrace.core.cloudwatch.query;

import static org.hypertrace.core.cloudwatch.query.TsdbFixtures.getFailMockResponse;
import static org.hypertrace.core.cloudwatch.query.TsdbFixtures.getSuccessMockResponse;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import io.reactivex.rxjava3.observers.TestObserver;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.core.cloudwatch.query.annotation.CloudWatchAnnotationClient;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;
import org.hypertrace.core.cloudwatch.query.api.DataSourceStatus;
import org.hypertrace.core.cloudwatch.query.api.DimensionValue;
import org.hypertrace.core.cloudwatch.query.api.QueryOptions;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.api.TimeSeries;
import org.hypertrace.core.cloudwatch.query.metadata.CloudWatchMetadataClient;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRequestException;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRequestException.ErrorType;
import org.hypertrace.core.cloudwatch.query.tsdb.CloudWatchRestClient;
import org.hypertrace.core.cloudwatch.query.validation.InvalidStatisticException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CloudWatchDataSourceTest {
  private static final Instant NOW = Instant.parse("2020-06-01T00:00:00Z");
  private static final TimeRange LAST_SIX_HOURS = TimeRange.of(NOW.minus(Duration.ofHours(6)), NOW);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final InMemoryTemplateService templateService =
      new InMemoryTemplateService()
          .withVariable("region", "us-west-2")
          .withMultiVariable("instances", List.of("i-123", "i-456"));

  private MockWebServer mockWebServer;
  private CloudWatchDataSource dataSource;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    CloudWatchDataSourceConfig config =
        new CloudWatchDataSourceConfig(
            ConfigFactory.parseString("id = 7, defaultRegion = us-east-1")
                .withValue("url", ConfigValueFactory.fromAnyRef(mockWebServer.url("/").toString())));
    CloudWatchRestClient restClient = new CloudWatchRestClient(config, new OkHttpClient());
    DimensionNormalizer dimensionNormalizer = new DimensionNormalizer(templateService);
    dataSource =
        new CloudWatchDataSource(
            config,
            templateService,
            new CloudWatchQueryConverter(
                config,
                templateService,
                dimensionNormalizer,
                new PeriodResolver(templateService, Clock.fixed(NOW, ZoneOffset.UTC))),
            restClient,
            new CloudWatchResponseBuilder(new CloudWatchConsoleUrlBuilder()),
            new CloudWatchMetadataClient(
                config, restClient, templateService, dimensionNormalizer, () -> LAST_SIX_HOURS),
            new CloudWatchAnnotationClient(config, restClient, templateService, dimensionNormalizer));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testQueryReturnsSeriesWithConsoleLink() throws Exception {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                "{\"results\":{\"A\":{\"series\":[{\"name\":\"s1\",\"points\":[[1,1000]]}],"
                    + "\"meta\":{\"searchExpressions\":[]}}}}"));

    List<TimeSeries> timeSeries =
        dataSource.query(options(cpuQuery("A").build())).blockingGet();

    assertEquals(1, timeSeries.size());
    assertEquals("s1", timeSeries.get(0).getLabel());
    assertEquals(1, timeSeries.get(0).getPoints().size());
    assertEquals(1.0, timeSeries.get(0).getPoints().get(0).getValue());
    assertEquals(1, timeSeries.get(0).getLinks().size());
    assertTrue(
        timeSeries
            .get(0)
            .getLinks()
            .get(0)
            .getUrl()
            .startsWith("https://us-west-2.console.aws.amazon.com/cloudwatch/deeplink.js"));

    RecordedRequest request = mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    JsonNode query = objectMapper.readTree(request.getBody().readUtf8()).get("queries").get(0);
    assertEquals("us-west-2", query.get("region").asText());
    assertEquals("300", query.get("period").asText());
    assertEquals(
        objectMapper.readTree("[\"i-123\",\"i-456\"]"), query.get("dimensions").get("InstanceId"));
  }

  @Test
  void testAllQueriesFilteredOutMakesNoCall() {
    List<TimeSeries> timeSeries =
        dataSource
            .query(
                options(
                    cpuQuery("A").hide(true).build(),
                    CloudWatchQuery.builder().refId("B").build()))
            .blockingGet();

    assertTrue(timeSeries.isEmpty());
    assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testInvalidStatisticMakesNoCall() {
    TestObserver<List<TimeSeries>> observer =
        dataSource
            .query(options(cpuQuery("A").build(), cpuQuery("B").statistic("pX0").build()))
            .test();

    observer.assertError(InvalidStatisticException.class);
    assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testValidationErrorIsReported() {
    mockWebServer.enqueue(getFailMockResponse(400, "tsdb_validation_error.json"));

    TestObserver<List<TimeSeries>> observer = dataSource.query(options(cpuQuery("A").build())).test();

    observer.awaitDone(5, TimeUnit.SECONDS);
    observer.assertError(
        error ->
            error instanceof CloudWatchRequestException
                && ((CloudWatchRequestException) error).getErrorType() == ErrorType.VALIDATION);
  }

  @Test
  void testThrottlingErrorIsReported() {
    mockWebServer.enqueue(getFailMockResponse(500, "tsdb_throttling_error.json"));

    TestObserver<List<TimeSeries>> observer = dataSource.query(options(cpuQuery("A").build())).test();

    observer.awaitDone(5, TimeUnit.SECONDS);
    observer.assertError(
        error ->
            error instanceof CloudWatchRequestException
                && ((CloudWatchRequestException) error).getErrorType() == ErrorType.THROTTLING);
  }

  @Test
  void testMissingResultsAreExcluded() {
    mockWebServer.enqueue(getSuccessMockResponse("tsdb_time_series_response.json"));

    List<TimeSeries> timeSeries =
        dataSource.query(options(cpuQuery("A").build(), cpuQuery("C").build())).blockingGet();

    assertEquals(1, timeSeries.size());
    assertEquals("CPUUtilization_Average", timeSeries.get(0).getLabel());
  }

  @Test
  void testTargetContainsTemplate() {
    assertTrue(dataSource.targetContainsTemplate(cpuQuery("A").build()));
    assertFalse(
        dataSource.targetContainsTemplate(
            cpuQuery("A").region("us-east-1").clearDimensions().build()));
    assertTrue(
        dataSource.targetContainsTemplate(
            CloudWatchQuery.builder()
                .refId("A")
                .dimension("InstanceId", DimensionValue.ofList(List.of("i-1", "$instances")))
                .build()));
    assertFalse(dataSource.targetContainsTemplate(CloudWatchQuery.builder().refId("A").build()));
    assertFalse(
        dataSource.targetContainsTemplate(
            CloudWatchQuery.builder()
                .refId("A")
                .dimension("InstanceId", DimensionValue.of(null))
                .build()));
  }

  @Test
  void testDatasourceHealthCheck() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("tsdb_metric_find_response.json"));

    DataSourceStatus status = dataSource.testDatasource().blockingGet();

    assertEquals(DataSourceStatus.success("Data source is working"), status);
    JsonNode query =
        objectMapper
            .readTree(mockWebServer.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8())
            .get("queries")
            .get(0);
    assertEquals("dimension_values", query.get("subtype").asText());
    assertEquals("us-east-1", query.get("region").asText());
    assertEquals("AWS/Billing", query.get("namespace").asText());
    assertEquals("EstimatedCharges", query.get("metricName").asText());
    assertEquals("ServiceName", query.get("dimensionKey").asText());
  }

  @Test
  void testDatasourceHealthCheckFailure() {
    mockWebServer.enqueue(getFailMockResponse(500, "tsdb_validation_error.json"));

    TestObserver<DataSourceStatus> observer = dataSource.testDatasource().test();

    observer.awaitDone(5, TimeUnit.SECONDS);
    observer.assertError(CloudWatchRequestException.class);
  }

  @Test
  void testConfigurationAccessors() {
    assertEquals("us-east-1", dataSource.getDefaultRegion());
    assertEquals("us-east-1", dataSource.getActualRegion("default"));
    assertEquals("eu-west-1", dataSource.getActualRegion("eu-west-1"));
    assertEquals(
        List.of("Average", "Maximum", "Minimum", "Sum", "SampleCount"),
        dataSource.getStandardStatistics());
  }

  private static CloudWatchQuery.CloudWatchQueryBuilder cpuQuery(String refId) {
    return CloudWatchQuery.builder()
        .refId(refId)
        .region("$region")
        .namespace("AWS/EC2")
        .metricName("CPUUtilization")
        .dimension("InstanceId", DimensionValue.of("$instances"))
        .statistic("Average");
  }

  private static QueryOptions options(CloudWatchQuery... targets) {
    return QueryOptions.builder()
        .targets(List.of(targets))
        .range(LAST_SIX_HOURS)
        .intervalMs(60000)
        .maxDataPoints(1000)
        .build();
  }
}
