package org.hypertrace.core.cloudwatch.query.api;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class MetricFindValue {
  String text;
  String value;
}
