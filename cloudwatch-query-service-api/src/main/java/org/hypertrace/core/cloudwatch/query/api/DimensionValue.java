package org.hypertrace.core.cloudwatch.query.api;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Value of a single dimension in a {@link CloudWatchQuery}. Either a single string, which may be a
 * template variable reference, or an explicit list of values.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonDeserialize(using = DimensionValue.DimensionValueDeserializer.class)
public class DimensionValue {
  String value;
  List<String> values;

  public static DimensionValue of(String value) {
    return new DimensionValue(value, null);
  }

  public static DimensionValue ofList(List<String> values) {
    return new DimensionValue(null, List.copyOf(values));
  }

  public boolean isList() {
    return values != null;
  }

  @JsonValue
  Object toJsonValue() {
    return isList() ? values : value;
  }

  static class DimensionValueDeserializer extends JsonDeserializer<DimensionValue> {

    @Override
    public DimensionValue deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      JsonNode node = parser.getCodec().readTree(parser);
      if (node.isArray()) {
        List<String> values = new ArrayList<>();
        node.elements().forEachRemaining(element -> values.add(element.asText()));
        return DimensionValue.ofList(values);
      }
      return DimensionValue.of(node.asText());
    }

    @Override
    public DimensionValue getNullValue(DeserializationContext context) {
      return DimensionValue.of(null);
    }
  }
}
