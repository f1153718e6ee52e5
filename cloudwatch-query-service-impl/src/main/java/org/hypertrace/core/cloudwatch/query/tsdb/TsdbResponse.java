package org.hypertrace.core.cloudwatch.query.tsdb;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.cloudwatch.query.api.DataPoint;

@Value
@Jacksonized
@Builder
public class TsdbResponse {
  private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

  @JsonProperty("results")
  @Builder.Default
  Map<String, TsdbQueryResult> results = Map.of();

  @Value
  @Jacksonized
  @Builder
  public static class TsdbQueryResult {
    @JsonProperty("refId")
    String refId;

    @JsonProperty("series")
    @Builder.Default
    List<TsdbSeries> series = List.of();

    @JsonProperty("tables")
    @Builder.Default
    List<TsdbTable> tables = List.of();

    @JsonProperty("meta")
    TsdbQueryResultMeta meta;

    @JsonProperty("error")
    String error;
  }

  @Value
  @Jacksonized
  @Builder
  public static class TsdbQueryResultMeta {
    @JsonProperty("searchExpressions")
    @Builder.Default
    List<String> searchExpressions = List.of();
  }

  @Value
  @Jacksonized
  @Builder
  public static class TsdbSeries {
    @JsonProperty("name")
    String name;

    @JsonProperty("points")
    @JsonDeserialize(using = TsdbPointsDeserializer.class)
    @Builder.Default
    List<DataPoint> points = List.of();
  }

  @Value
  @Jacksonized
  @Builder
  public static class TsdbTable {
    @JsonProperty("rows")
    @Builder.Default
    List<List<String>> rows = List.of();
  }

  /** Points arrive as {@code [value, timestampMs]} pairs, with null values for gaps. */
  static class TsdbPointsDeserializer extends JsonDeserializer<List<DataPoint>> {

    @Override
    public List<DataPoint> deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      List<DataPoint> points = new ArrayList<>();
      JsonNode node = parser.getCodec().readTree(parser);
      node.elements()
          .forEachRemaining(
              point -> {
                // a point without a timestamp cannot be placed on the time axis
                if (point.size() >= 2 && point.get(1).isNumber()) {
                  points.add(parsePoint(point));
                }
              });
      return points;
    }

    @Override
    public List<DataPoint> getNullValue(DeserializationContext context) {
      return List.of();
    }

    private DataPoint parsePoint(JsonNode pointNode) {
      JsonNode valueNode = pointNode.get(0);
      Double value = valueNode == null || valueNode.isNull() ? null : valueNode.asDouble();
      Instant timestamp = Instant.ofEpochMilli((long) pointNode.get(1).asDouble());
      return DataPoint.of(timestamp, value);
    }
  }

  private static ObjectMapper createObjectMapper() {
    ObjectMapper objectMapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    // the backend serializes empty slices and maps as null
    objectMapper
        .configOverride(List.class)
        .setSetterInfo(JsonSetter.Value.forValueNulls(Nulls.AS_EMPTY));
    objectMapper
        .configOverride(Map.class)
        .setSetterInfo(JsonSetter.Value.forValueNulls(Nulls.AS_EMPTY));
    return objectMapper;
  }

  public static TsdbResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, TsdbResponse.class);
  }
}
