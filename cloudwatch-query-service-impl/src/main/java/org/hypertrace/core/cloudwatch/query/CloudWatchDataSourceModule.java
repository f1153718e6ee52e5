package org.hypertrace.core.cloudwatch.query;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import java.time.Clock;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;
import org.hypertrace.core.cloudwatch.query.api.TemplateService;
import org.hypertrace.core.cloudwatch.query.api.TimeRangeProvider;

/**
 * Wires the datasource from its configuration. The hosting application provides the {@link
 * TemplateService} and the {@link TimeRangeProvider} of the dashboard.
 */
public class CloudWatchDataSourceModule extends AbstractModule {

  private final CloudWatchDataSourceConfig config;

  public CloudWatchDataSourceModule(Config config) {
    this.config = new CloudWatchDataSourceConfig(config);
  }

  @Override
  protected void configure() {
    bind(CloudWatchDataSourceConfig.class).toInstance(this.config);
    bind(Clock.class).toInstance(Clock.systemUTC());
    requireBinding(TemplateService.class);
    requireBinding(TimeRangeProvider.class);
  }

  @Provides
  @Singleton
  OkHttpClient provideOkHttpClient() {
    return new OkHttpClient.Builder()
        .connectTimeout(config.getClientConfig().getConnectTimeout())
        .readTimeout(config.getClientConfig().getReadTimeout())
        .build();
  }
}
