package org.hypertrace.core.cloudwatch.query.api;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class TimeRange {
  @NonNull Instant from;
  @NonNull Instant to;
}
