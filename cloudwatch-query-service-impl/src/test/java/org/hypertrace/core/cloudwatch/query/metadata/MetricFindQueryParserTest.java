package org.hypertrace.core.cloudwatch.query.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MetricFindQueryParserTest {

  private final MetricFindQueryParser parser = new MetricFindQueryParser();

  @Test
  void testFunctionsWithoutArguments() {
    assertEquals(
        Optional.of(new MetricFindQuery(MetricFindQueryType.REGIONS, List.of())),
        parser.parse("regions()"));
    assertEquals(
        Optional.of(new MetricFindQuery(MetricFindQueryType.NAMESPACES, List.of())),
        parser.parse("namespaces()"));
  }

  @Test
  void testOptionalRegion() {
    MetricFindQuery query = parser.parse("metrics(AWS/EC2)").orElseThrow();
    assertEquals(MetricFindQueryType.METRICS, query.getType());
    assertEquals("AWS/EC2", query.getArgument(0));
    assertEquals("", query.getOptionalArgument(1));

    assertEquals(
        List.of("AWS/EC2", "$region"),
        parser.parse("dimension_keys( AWS/EC2 , $region )").orElseThrow().getArguments());
  }

  @Test
  void testDimensionValuesWithFilter() {
    MetricFindQuery query =
        parser
            .parse(
                "dimension_values(us-east-1,AWS/EC2,CPUUtilization,InstanceId,"
                    + "{\"AutoScalingGroupName\":[\"a\",\"b\"],\"Env\":\"prod,test\"})")
            .orElseThrow();

    assertEquals(5, query.getArguments().size());
    assertEquals(
        "{\"AutoScalingGroupName\":[\"a\",\"b\"],\"Env\":\"prod,test\"}", query.getArgument(4));
  }

  @Test
  void testJsonArgumentKeepsCommas() {
    MetricFindQuery query =
        parser
            .parse("ec2_instance_attribute(us-east-1, InstanceId, {\"tag:Env\":[\"a\",\"b\"]})")
            .orElseThrow();

    assertEquals(MetricFindQueryType.EC2_INSTANCE_ATTRIBUTE, query.getType());
    assertEquals(List.of("us-east-1", "InstanceId", "{\"tag:Env\":[\"a\",\"b\"]}"), query.getArguments());
  }

  @Test
  void testTrailingTextIsIgnored() {
    assertEquals(
        List.of("us-east-1", "i-123"),
        parser.parse("ebs_volume_ids(us-east-1, i-123) trailing").orElseThrow().getArguments());
  }

  @Test
  void testUnmatchedQueries() {
    assertTrue(parser.parse(null).isEmpty());
    assertTrue(parser.parse("").isEmpty());
    assertTrue(parser.parse("regions").isEmpty());
    assertTrue(parser.parse("unknown(a)").isEmpty());
    assertTrue(parser.parse("metrics()").isEmpty());
    assertTrue(parser.parse("metrics(AWS/EC2").isEmpty());
    assertTrue(parser.parse("regions(us-east-1)").isEmpty());
    assertTrue(parser.parse("dimension_values(us-east-1,AWS/EC2,CPUUtilization)").isEmpty());
    assertTrue(parser.parse("ebs_volume_ids(us-east-1,)").isEmpty());
    assertTrue(parser.parse(" regions()").isEmpty());
  }
}
