package org.hypertrace.core.cloudwatch.query.tsdb;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;

/** Body of a single batched call to the query endpoint. */
@Value
@Builder
public class TsdbRequest {
  /** Millisecond epoch, as a string. */
  @NonNull String from;

  /** Millisecond epoch, as a string. */
  @NonNull String to;

  @Singular List<TsdbQuery> queries;

  public static TsdbRequest forTimeRange(TimeRange timeRange, List<? extends TsdbQuery> queries) {
    return TsdbRequest.builder()
        .from(String.valueOf(timeRange.getFrom().toEpochMilli()))
        .to(String.valueOf(timeRange.getTo().toEpochMilli()))
        .queries(queries)
        .build();
  }
}
