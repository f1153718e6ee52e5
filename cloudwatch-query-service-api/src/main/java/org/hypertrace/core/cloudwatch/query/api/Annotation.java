package org.hypertrace.core.cloudwatch.query.api;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Annotation {
  AnnotationDefinition annotation;
  Instant time;
  String title;
  @Singular List<String> tags;
  String text;
}
