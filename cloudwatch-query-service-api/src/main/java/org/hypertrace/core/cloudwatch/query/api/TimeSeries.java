package org.hypertrace.core.cloudwatch.query.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TimeSeries {
  String label;
  @Singular List<DataPoint> points;
  @Singular List<DataLink> links;
}
