package org.hypertrace.core.cloudwatch.query.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class QueryOptions {
  @Singular List<CloudWatchQuery> targets;

  @NonNull TimeRange range;

  @Builder.Default ScopedVars scopedVars = ScopedVars.empty();

  long intervalMs;

  long maxDataPoints;
}
