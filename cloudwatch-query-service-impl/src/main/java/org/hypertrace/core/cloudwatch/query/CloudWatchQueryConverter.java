package org.hypertrace.core.cloudwatch.query;

import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;
import org.hypertrace.core.cloudwatch.query.api.QueryOptions;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.util.CloudWatchQueryUtil;
import org.hypertrace.core.cloudwatch.query.tsdb.TimeSeriesTsdbQuery;
import org.hypertrace.core.cloudwatch.query.validation.ExtendedStatisticsValidation;

/**
 * Rewrites the submittable queries of a request into their wire form: every template variable is
 * resolved, statistics are validated and the sampling period is fixed.
 */
class CloudWatchQueryConverter {

  private final CloudWatchDataSourceConfig config;
  private final TemplateService templateService;
  private final DimensionNormalizer dimensionNormalizer;
  private final PeriodResolver periodResolver;
  private final ExtendedStatisticsValidation statisticsValidation;

  @Inject
  CloudWatchQueryConverter(
      CloudWatchDataSourceConfig config,
      TemplateService templateService,
      DimensionNormalizer dimensionNormalizer,
      PeriodResolver periodResolver) {
    this.config = config;
    this.templateService = templateService;
    this.dimensionNormalizer = dimensionNormalizer;
    this.periodResolver = periodResolver;
    this.statisticsValidation = new ExtendedStatisticsValidation();
  }

  /**
   * Converts the request targets in order, dropping those which are not submittable.
   *
   * @throws org.hypertrace.core.cloudwatch.query.validation.InvalidStatisticException if any query
   *     carries a malformed percentile statistic
   * @throws org.hypertrace.core.cloudwatch.query.utils.InvalidPeriodException if any query carries
   *     a period that cannot be parsed
   */
  List<TimeSeriesTsdbQuery> convert(QueryOptions options) {
    return options.getTargets().stream()
        .filter(CloudWatchQueryUtil::isSubmittable)
        .map(target -> convert(target, options))
        .collect(Collectors.toUnmodifiableList());
  }

  private TimeSeriesTsdbQuery convert(CloudWatchQuery target, QueryOptions options) {
    ScopedVars scopedVars = options.getScopedVars();
    String region = replace(config.getActualRegion(target.getRegion()), scopedVars);
    String namespace = replace(target.getNamespace(), scopedVars);
    List<String> statistics =
        target.getStatistics().stream()
            .map(statistic -> replace(statistic, scopedVars))
            .collect(Collectors.toUnmodifiableList());
    statisticsValidation.validate(statistics);

    // the default period depends on the resolved namespace
    long period =
        periodResolver.resolvePeriod(
            target.toBuilder().namespace(namespace).build(), options.getRange(), scopedVars);

    return TimeSeriesTsdbQuery.builder()
        .refId(target.getRefId())
        .intervalMs(options.getIntervalMs())
        .maxDataPoints(options.getMaxDataPoints())
        .datasourceId(config.getId())
        .id(replace(target.getId(), scopedVars))
        .region(region)
        .namespace(namespace)
        .metricName(replace(target.getMetricName(), scopedVars))
        .dimensions(dimensionNormalizer.normalize(target.getDimensions(), scopedVars))
        .statistics(statistics)
        .period(String.valueOf(period))
        .expression(replace(target.getExpression(), scopedVars))
        .highResolution(target.isHighResolution())
        .hide(target.isHide())
        .alias(target.getAlias())
        .matchExact(target.isMatchExact())
        .build();
  }

  private String replace(String target, ScopedVars scopedVars) {
    return templateService.replace(target, scopedVars);
  }
}
