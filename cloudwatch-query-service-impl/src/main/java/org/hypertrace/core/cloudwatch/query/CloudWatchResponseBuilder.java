package org.hypertrace.core.cloudwatch.query;

import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.cloudwatch.query.api.DataLink;
import org.hypertrace.core.cloudwatch.query.api.TimeRange;
import org.hypertrace.core.cloudwatch.query.api.TimeSeries;
import org.hypertrace.core.cloudwatch.query.tsdb.TimeSeriesTsdbQuery;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse.TsdbQueryResult;
import org.hypertrace.core.cloudwatch.query.tsdb.TsdbResponse.TsdbSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a batched response back onto the submitted queries by ref id and flattens the series of
 * every answered query into a single list.
 */
class CloudWatchResponseBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchResponseBuilder.class);

  static final String CONSOLE_LINK_TITLE = "View in CloudWatch console";

  private final CloudWatchConsoleUrlBuilder consoleUrlBuilder;

  @Inject
  CloudWatchResponseBuilder(CloudWatchConsoleUrlBuilder consoleUrlBuilder) {
    this.consoleUrlBuilder = consoleUrlBuilder;
  }

  List<TimeSeries> buildResponse(
      TsdbResponse response, List<TimeSeriesTsdbQuery> queries, TimeRange timeRange) {
    List<TimeSeries> timeSeriesList = new ArrayList<>();
    for (TimeSeriesTsdbQuery query : queries) {
      TsdbQueryResult queryResult = response.getResults().get(query.getRefId());
      if (queryResult == null) {
        LOG.debug("No result returned for query {}", query.getRefId());
        continue;
      }
      if (queryResult.getError() != null) {
        LOG.debug("Query {} returned an error: {}", query.getRefId(), queryResult.getError());
      }

      DataLink consoleLink =
          DataLink.of(
              consoleUrlBuilder.buildConsoleUrl(
                  query,
                  timeRange.getFrom(),
                  timeRange.getTo(),
                  query.getRefId(),
                  queryResult.getMeta() == null
                      ? List.of()
                      : queryResult.getMeta().getSearchExpressions()),
              CONSOLE_LINK_TITLE,
              true);

      for (TsdbSeries series : queryResult.getSeries()) {
        timeSeriesList.add(
            TimeSeries.builder()
                .label(series.getName())
                .points(series.getPoints())
                .link(consoleLink)
                .build());
      }
    }
    return timeSeriesList;
  }
}
