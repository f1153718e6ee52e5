package org.hypertrace.core.cloudwatch.query.api;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class DataPoint {
  Instant timestamp;
  /** Null for a gap in the series. */
  Double value;
}
