package org.hypertrace.core.cloudwatch.query;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.cloudwatch.query.api.CloudWatchQuery;
import org.hypertrace.core.cloudwatch.query.api.ScopedVars;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.utils.InvalidPeriodException;
import org.hypertrace.core.cloudwatch.query.utils.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the sampling period, in seconds, of a query. CloudWatch keeps coarser data the older it
 * gets, so without an explicit period the default depends on how far back the range starts. The
 * period is then widened until the range yields fewer than {@link #MAX_DATA_POINTS} points, unless
 * the query asks for high resolution data.
 */
class PeriodResolver {
  private static final Logger LOG = LoggerFactory.getLogger(PeriodResolver.class);

  static final int MAX_DATA_POINTS = 1440;

  private static final String EC2_NAMESPACE = "AWS/EC2";
  private static final Pattern INTEGER_PERIOD_PATTERN = Pattern.compile("^\\d+$");
  private static final long DEFAULT_PERIOD_UNIT = 60;

  private static final long FIFTEEN_DAYS = Duration.ofDays(15).getSeconds();
  private static final long SIXTY_THREE_DAYS = Duration.ofDays(63).getSeconds();
  private static final long FOUR_HUNDRED_FIFTY_FIVE_DAYS = Duration.ofDays(455).getSeconds();

  private final TemplateService templateService;
  private final Clock clock;

  @Inject
  PeriodResolver(TemplateService templateService, Clock clock) {
    this.templateService = templateService;
    this.clock = clock;
  }

  long resolvePeriod(CloudWatchQuery target, TimeRange timeRange, ScopedVars scopedVars) {
    return resolvePeriod(target, timeRange, scopedVars, clock.instant());
  }

  long resolvePeriod(
      CloudWatchQuery target, TimeRange timeRange, ScopedVars scopedVars, Instant now) {
    long start = TimeUtil.toEpochSeconds(timeRange.getFrom(), false);
    long end = TimeUtil.toEpochSeconds(timeRange.getTo(), true);
    long nowSeconds = TimeUtil.roundToEpochSeconds(now);
    long range = end - start;

    // an explicit period keeps the 60s unit when it gets coarsened below
    long periodUnit = DEFAULT_PERIOD_UNIT;
    long period;
    if (StringUtils.isEmpty(target.getPeriod())) {
      periodUnit = period = getDefaultPeriod(nowSeconds - start, target.getNamespace());
    } else if (INTEGER_PERIOD_PATTERN.matcher(target.getPeriod()).matches()) {
      period = parseLiteralPeriod(target.getPeriod());
    } else {
      String interval = templateService.replace(target.getPeriod(), scopedVars);
      period = (long) TimeUtil.intervalToSeconds(interval);
    }

    if (period < 1) {
      period = 1;
    }
    if (!target.isHighResolution() && (double) range / period >= MAX_DATA_POINTS) {
      period = (long) Math.ceil((double) range / MAX_DATA_POINTS / periodUnit) * periodUnit;
    }
    return period;
  }

  private long getDefaultPeriod(long ageOfStart, String namespace) {
    if (ageOfStart <= FIFTEEN_DAYS) {
      return EC2_NAMESPACE.equals(namespace) ? 300 : 60;
    }
    if (ageOfStart <= SIXTY_THREE_DAYS) {
      return 300;
    }
    if (ageOfStart > FOUR_HUNDRED_FIFTY_FIVE_DAYS) {
      LOG.debug(
          "Range starts {}s ago, beyond the retention of hourly data. Using hourly period anyway",
          ageOfStart);
    }
    return 3600;
  }

  private long parseLiteralPeriod(String period) {
    try {
      return Long.parseLong(period);
    } catch (NumberFormatException e) {
      throw new InvalidPeriodException("Period is out of range: " + period, e);
    }
  }
}
