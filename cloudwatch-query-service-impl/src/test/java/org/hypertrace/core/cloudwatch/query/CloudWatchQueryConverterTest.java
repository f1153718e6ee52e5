package org.hypertrace.core.cloudwatch.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;
import org.hypertrace.core.cloudwatch.query.api.DimensionValue;
import org.hypertrace.core.cloudwatch.query.api.QueryOptions;
import org.hypertrace.core.cloudwatch.query.api.ScopedVar;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.tsdb.TimeSeriesTsdbQuery;
import org.hypertrace.core.cloudwatch.query.utils.InvalidPeriodException;
import org.hypertrace.core.cloudwatch.query.validation.InvalidStatisticException;
import org.junit.jupiter.api.Test;

class CloudWatchQueryConverterTest {
  private static final Instant NOW = Instant.parse("2020-06-01T00:00:00Z");
  private static final TimeRange LAST_SIX_HOURS = TimeRange.of(NOW.minus(Duration.ofHours(6)), NOW);

  private final CloudWatchDataSourceConfig config =
      new CloudWatchDataSourceConfig(
          ConfigFactory.parseString(
              "id = 7, url = \"http://localhost:3000\", defaultRegion = eu-west-1"));
  private final InMemoryTemplateService templateService =
      new InMemoryTemplateService()
          .withVariable("region", "us-west-2")
          .withVariable("namespace", "AWS/RDS")
          .withVariable("stat", "Maximum")
          .withVariable("instance", "db-1");
  private final CloudWatchQueryConverter converter =
      new CloudWatchQueryConverter(
          config,
          templateService,
          new DimensionNormalizer(templateService),
          new PeriodResolver(templateService, Clock.fixed(NOW, ZoneOffset.UTC)));

  @Test
  void testConvertMetricStatQuery() {
    QueryOptions options =
        options(
            CloudWatchQuery.builder()
                .refId("A")
                .region("$region")
                .namespace("$namespace")
                .metricName("CPUUtilization")
                .dimension("DBInstanceIdentifier", DimensionValue.of("$instance"))
                .statistic("Average")
                .statistic("$stat")
                .alias("{{metric}}")
                .build());

    List<TimeSeriesTsdbQuery> queries = converter.convert(options);

    assertEquals(1, queries.size());
    TimeSeriesTsdbQuery query = queries.get(0);
    assertEquals("A", query.getRefId());
    assertEquals(TimeSeriesTsdbQuery.TYPE, query.getType());
    assertEquals(7, query.getDatasourceId());
    assertEquals(1000, query.getIntervalMs());
    assertEquals(500, query.getMaxDataPoints());
    assertEquals("us-west-2", query.getRegion());
    assertEquals("AWS/RDS", query.getNamespace());
    assertEquals("CPUUtilization", query.getMetricName());
    assertEquals(Map.of("DBInstanceIdentifier", List.of("db-1")), query.getDimensions());
    assertEquals(List.of("Average", "Maximum"), query.getStatistics());
    assertEquals("60", query.getPeriod());
    assertEquals("{{metric}}", query.getAlias());
    assertTrue(query.isMatchExact());
  }

  @Test
  void testDefaultRegionAliasResolvesToConfiguredRegion() {
    List<TimeSeriesTsdbQuery> queries =
        converter.convert(
            options(metricStat("A").region("default").build(), metricStat("B").region("").build()));

    // a metric stat query without any region is not submittable
    assertEquals(1, queries.size());
    assertEquals("eu-west-1", queries.get(0).getRegion());
  }

  @Test
  void testDefaultPeriodUsesResolvedNamespace() {
    templateService.withVariable("ns", "AWS/EC2");

    List<TimeSeriesTsdbQuery> queries =
        converter.convert(options(metricStat("A").namespace("$ns").build()));

    assertEquals("AWS/EC2", queries.get(0).getNamespace());
    assertEquals("300", queries.get(0).getPeriod());
  }

  @Test
  void testExplicitPeriodIsKept() {
    List<TimeSeriesTsdbQuery> queries =
        converter.convert(options(metricStat("A").period("120").build()));

    assertEquals("120", queries.get(0).getPeriod());
  }

  @Test
  void testNonSubmittableQueriesAreDropped() {
    List<TimeSeriesTsdbQuery> queries =
        converter.convert(
            options(
                metricStat("A").hide(true).build(),
                CloudWatchQuery.builder().refId("B").region("us-east-1").build(),
                metricStat("C").build(),
                CloudWatchQuery.builder()
                    .refId("D")
                    .id("m1")
                    .hide(true)
                    .expression("SUM(METRICS())")
                    .build()));

    assertEquals(List.of("C", "D"), queries.stream().map(TimeSeriesTsdbQuery::getRefId).collect(Collectors.toList()));
    assertEquals("SUM(METRICS())", queries.get(1).getExpression());
    assertEquals("m1", queries.get(1).getId());
  }

  @Test
  void testQueryWithoutRefIdIsStillSent() throws IOException {
    CloudWatchQuery target =
        new ObjectMapper()
            .readValue(
                "{\"region\":\"us-east-1\",\"namespace\":\"AWS/EC2\",\"metricName\":\"CPU\","
                    + "\"statistics\":[\"Average\"]}",
                CloudWatchQuery.class);

    List<TimeSeriesTsdbQuery> queries = converter.convert(options(target, metricStat("B").build()));

    assertEquals(2, queries.size());
    assertEquals("", queries.get(0).getRefId());
    assertEquals("B", queries.get(1).getRefId());
  }

  @Test
  void testNullDimensionDoesNotFailTheBatch() throws IOException {
    CloudWatchQuery target =
        new ObjectMapper()
            .readValue(
                "{\"refId\":\"A\",\"region\":\"us-east-1\",\"namespace\":\"AWS/EC2\","
                    + "\"metricName\":\"CPU\",\"statistics\":[\"Average\"],"
                    + "\"dimensions\":{\"InstanceId\":null}}",
                CloudWatchQuery.class);

    List<TimeSeriesTsdbQuery> queries = converter.convert(options(target));

    assertEquals(1, queries.size());
    assertTrue(queries.get(0).getDimensions().containsKey("InstanceId"));
  }

  @Test
  void testScopedVarsAreApplied() {
    QueryOptions options =
        QueryOptions.builder()
            .target(metricStat("A").region("$region").build())
            .range(LAST_SIX_HOURS)
            .scopedVars(ScopedVars.of(Map.of("region", ScopedVar.of("ap", "ap-south-1"))))
            .build();

    assertEquals("ap-south-1", converter.convert(options).get(0).getRegion());
  }

  @Test
  void testInvalidStatisticFailsTheWholeBatch() {
    QueryOptions options =
        options(metricStat("A").build(), metricStat("B").statistic("p9").build());

    assertThrows(InvalidStatisticException.class, () -> converter.convert(options));
  }

  @Test
  void testTemplatedStatisticIsValidatedAfterReplacement() {
    templateService.withVariable("percentile", "p100.123");

    QueryOptions options = options(metricStat("A").statistic("$percentile").build());

    assertThrows(InvalidStatisticException.class, () -> converter.convert(options));
  }

  @Test
  void testInvalidPeriod() {
    QueryOptions options = options(metricStat("A").period("soon").build());

    assertThrows(InvalidPeriodException.class, () -> converter.convert(options));
  }

  private static CloudWatchQuery.CloudWatchQueryBuilder metricStat(String refId) {
    return CloudWatchQuery.builder()
        .refId(refId)
        .region("us-east-1")
        .namespace("AWS/RDS")
        .metricName("CPUUtilization")
        .statistic("Average");
  }

  private static QueryOptions options(CloudWatchQuery... targets) {
    return QueryOptions.builder()
        .targets(List.of(targets))
        .range(LAST_SIX_HOURS)
        .intervalMs(1000)
        .maxDataPoints(500)
        .build();
  }
}
