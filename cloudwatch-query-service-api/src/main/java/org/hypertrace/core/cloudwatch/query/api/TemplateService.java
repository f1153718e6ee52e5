package org.hypertrace.core.cloudwatch.query.api;

import java.util.List;

/**
 * Dashboard template variable substitution. Implementations are provided by the hosting
 * application; the query engine only reads from it.
 */
public interface TemplateService {

  /** Format that joins the values of a multi-valued variable with {@code |}. */
  String PIPE_FORMAT = "pipe";

  String replace(String target, ScopedVars scopedVars);

  /**
   * Replaces variable references in {@code target}, rendering multi-valued variables using the
   * given format.
   */
  String replace(String target, ScopedVars scopedVars, String format);

  default String replace(String target) {
    return replace(target, ScopedVars.empty());
  }

  boolean variableExists(String expression);

  /** Returns the name of the first variable referenced by {@code expression}, or null. */
  String getVariableName(String expression);

  List<TemplateVariable> getVariables();
}
