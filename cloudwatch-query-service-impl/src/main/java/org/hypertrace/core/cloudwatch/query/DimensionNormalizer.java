package org.hypertrace.core.cloudwatch.query;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.cloudwatch.query.api.DimensionValue;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TemplateVariable;

/** Converts user supplied dimensions into lists of values, expanding template variables. */
public class DimensionNormalizer {
  private static final String MULTI_VALUE_SEPARATOR = "\\|";

  private final TemplateService templateService;

  @Inject
  public DimensionNormalizer(TemplateService templateService) {
    this.templateService = templateService;
  }

  public Map<String, List<String>> normalize(
      Map<String, DimensionValue> dimensions, ScopedVars scopedVars) {
    Map<String, List<String>> normalized = new LinkedHashMap<>();
    dimensions.forEach((key, value) -> normalized.put(key, normalizeValue(value, scopedVars)));
    return normalized;
  }

  private List<String> normalizeValue(DimensionValue dimensionValue, ScopedVars scopedVars) {
    if (dimensionValue != null && dimensionValue.isList()) {
      return dimensionValue.getValues();
    }

    String value = dimensionValue == null ? null : dimensionValue.getValue();
    if (value == null) {
      // a missing value is passed on as is
      return Collections.singletonList(null);
    }
    Optional<TemplateVariable> variable = findVariable(value);
    if (variable.isEmpty()) {
      return List.of(value);
    }
    if (variable.get().isMulti()) {
      return Arrays.asList(
          templateService
              .replace(value, scopedVars, TemplateService.PIPE_FORMAT)
              .split(MULTI_VALUE_SEPARATOR, -1));
    }
    return List.of(templateService.replace(value, scopedVars));
  }

  private Optional<TemplateVariable> findVariable(String value) {
    String variableName = templateService.getVariableName(value);
    return templateService.getVariables().stream()
        .filter(variable -> Objects.equals(variable.getName(), variableName))
        .findFirst();
  }
}
