package org.hypertrace.core.cloudwatch.query.api;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class DataSourceStatus {
  public static final String SUCCESS = "success";

  String status;
  String message;

  public static DataSourceStatus success(String message) {
    return of(SUCCESS, message);
  }
}
