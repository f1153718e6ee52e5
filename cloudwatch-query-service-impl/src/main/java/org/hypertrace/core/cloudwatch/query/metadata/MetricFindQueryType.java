package org.hypertrace.core.cloudwatch.query.metadata;

import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Lookup functions accepted in a variable query, with the arity of each. */
@Getter
@AllArgsConstructor
public enum MetricFindQueryType {
  REGIONS("regions", 0, 0),
  NAMESPACES("namespaces", 0, 0),
  METRICS("metrics", 1, 2),
  DIMENSION_KEYS("dimension_keys", 1, 2),
  DIMENSION_VALUES("dimension_values", 4, 5),
  EBS_VOLUME_IDS("ebs_volume_ids", 2, 2),
  EC2_INSTANCE_ATTRIBUTE("ec2_instance_attribute", 3, 3),
  RESOURCE_ARNS("resource_arns", 3, 3);

  private final String functionName;
  private final int minArguments;
  private final int maxArguments;

  static Optional<MetricFindQueryType> fromFunctionName(String functionName) {
    return Arrays.stream(values())
        .filter(type -> type.functionName.equals(functionName))
        .findFirst();
  }

  boolean acceptsArgumentCount(int count) {
    return count >= minArguments && count <= maxArguments;
  }
}
