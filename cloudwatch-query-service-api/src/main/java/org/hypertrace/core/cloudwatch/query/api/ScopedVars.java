package org.hypertrace.core.cloudwatch.query.api;

import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Per request variable values which take precedence over the dashboard variables. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScopedVars {
  private static final ScopedVars EMPTY = new ScopedVars(Map.of());

  Map<String, ScopedVar> variables;

  public static ScopedVars empty() {
    return EMPTY;
  }

  public static ScopedVars of(Map<String, ScopedVar> variables) {
    return new ScopedVars(Map.copyOf(variables));
  }

  public Optional<ScopedVar> get(String name) {
    return Optional.ofNullable(variables.get(name));
  }
}
