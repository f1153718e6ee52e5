package org.hypertrace.core.cloudwatch.query.api;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class DataLink {
  String url;
  String title;
  boolean targetBlank;
}
