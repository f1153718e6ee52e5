package org.hypertrace.core.cloudwatch.query.metadata;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** A parsed variable query: the lookup function and its raw, unsubstituted arguments. */
@Value
public class MetricFindQuery {
  @NonNull MetricFindQueryType type;
  @NonNull List<String> arguments;

  String getArgument(int index) {
    return arguments.get(index);
  }

  /** Returns the argument at {@code index}, or an empty string when it was omitted. */
  String getOptionalArgument(int index) {
    return index < arguments.size() ? arguments.get(index) : "";
  }
}
