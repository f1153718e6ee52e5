package org.hypertrace.core.cloudwatch.query;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.List;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.apache.commons.lang3.StringUtils;

@Value
@NonFinal
public class CloudWatchDataSourceConfig {

  private static final String CONFIG_PATH_ID = "id";
  private static final String CONFIG_PATH_URL = "url";
  private static final String CONFIG_PATH_DEFAULT_REGION = "defaultRegion";
  private static final String CONFIG_PATH_STANDARD_STATISTICS = "standardStatistics";
  private static final String CONFIG_PATH_CLIENT = "client";

  private static final String DEFAULT_REGION_ALIAS = "default";
  private static final List<String> DEFAULT_STANDARD_STATISTICS =
      List.of("Average", "Maximum", "Minimum", "Sum", "SampleCount");

  long id;
  String url;
  String defaultRegion;
  List<String> standardStatistics;
  ClientConfig clientConfig;

  public CloudWatchDataSourceConfig(Config config) {
    Config resolved = config.resolve();
    this.id = resolved.getLong(CONFIG_PATH_ID);
    this.url = resolved.getString(CONFIG_PATH_URL);
    this.defaultRegion = resolved.getString(CONFIG_PATH_DEFAULT_REGION);
    this.standardStatistics =
        resolved.hasPath(CONFIG_PATH_STANDARD_STATISTICS)
            ? List.copyOf(resolved.getStringList(CONFIG_PATH_STANDARD_STATISTICS))
            : DEFAULT_STANDARD_STATISTICS;
    this.clientConfig =
        new ClientConfig(
            resolved.hasPath(CONFIG_PATH_CLIENT)
                ? resolved.getConfig(CONFIG_PATH_CLIENT)
                : ConfigFactory.empty());
  }

  /** Maps the {@code default} alias, or a missing region, to the configured default region. */
  public String getActualRegion(String region) {
    if (DEFAULT_REGION_ALIAS.equals(region) || StringUtils.isEmpty(region)) {
      return defaultRegion;
    }
    return region;
  }

  @Value
  @NonFinal
  public static class ClientConfig {
    private static final String CONFIG_PATH_CONNECT_TIMEOUT = "connectTimeout";
    private static final String CONFIG_PATH_READ_TIMEOUT = "readTimeout";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    Duration connectTimeout;
    Duration readTimeout;

    private ClientConfig(Config config) {
      this.connectTimeout =
          config.hasPath(CONFIG_PATH_CONNECT_TIMEOUT)
              ? config.getDuration(CONFIG_PATH_CONNECT_TIMEOUT)
              : DEFAULT_CONNECT_TIMEOUT;
      this.readTimeout =
          config.hasPath(CONFIG_PATH_READ_TIMEOUT)
              ? config.getDuration(CONFIG_PATH_READ_TIMEOUT)
              : DEFAULT_READ_TIMEOUT;
    }
  }
}
