package org.hypertrace.core.cloudwatch.query.utils;

import com.google.common.base.Preconditions;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TimeUtil {

  private static final Pattern INTERVAL_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|[Mwdhmsy])");
  private static final Map<String, Double> INTERVALS_IN_SECONDS =
      Map.of(
          "y", 31536000d,
          "M", 2592000d,
          "w", 604800d,
          "d", 86400d,
          "h", 3600d,
          "m", 60d,
          "s", 1d,
          "ms", 0.001d);

  private TimeUtil() {}

  public static long round(double value, int places) {
    Preconditions.checkArgument(places >= 0, "places must not be negative: %s", places);
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).longValue();
  }

  public static long toEpochSeconds(Instant instant, boolean roundUp) {
    long millis = instant.toEpochMilli();
    return roundUp ? Math.floorDiv(millis + 999, 1000) : Math.floorDiv(millis, 1000);
  }

  /** Nearest whole epoch second, halves rounded up. */
  public static long roundToEpochSeconds(Instant instant) {
    return round(instant.toEpochMilli() / 1000.0, 0);
  }

  /**
   * Converts an interval such as {@code 30s}, {@code 5m} or {@code 1d} into seconds. Only the
   * integral part of the count is used, so {@code 1.5h} is one hour.
   *
   * @throws InvalidPeriodException if no interval can be found in the string
   */
  public static double intervalToSeconds(String interval) {
    Matcher matcher = interval == null ? null : INTERVAL_PATTERN.matcher(interval);
    if (matcher == null || !matcher.find()) {
      throw new InvalidPeriodException(
          String.format(
              "Invalid interval string '%s', expecting a number followed by one of \"Mwdhmsy\"",
              interval));
    }
    String count = matcher.group(1);
    int fractionIndex = count.indexOf('.');
    String integralCount = fractionIndex < 0 ? count : count.substring(0, fractionIndex);
    try {
      return Long.parseLong(integralCount) * INTERVALS_IN_SECONDS.get(matcher.group(2));
    } catch (NumberFormatException e) {
      throw new InvalidPeriodException("Interval is out of range: " + interval, e);
    }
  }
}
