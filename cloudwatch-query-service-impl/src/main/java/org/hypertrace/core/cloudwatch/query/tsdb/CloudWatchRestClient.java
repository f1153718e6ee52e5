package org.hypertrace.core.cloudwatch.query.tsdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.rxjava3.core.Single;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.cloudwatch.query.CloudWatchDataSourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts batched queries to the datasource query endpoint. Every call is a single asynchronous
 * request; nothing is retried or cancelled.
 */
@Singleton
public class CloudWatchRestClient {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchRestClient.class);

  private static final String TSDB_QUERY_PATH = "api/tsdb/query";
  private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final HttpUrl queryUrl;
  private final OkHttpClient okHttpClient;

  @Inject
  public CloudWatchRestClient(CloudWatchDataSourceConfig config, OkHttpClient okHttpClient) {
    this.queryUrl =
        HttpUrl.get(config.getUrl()).newBuilder().addPathSegments(TSDB_QUERY_PATH).build();
    this.okHttpClient = okHttpClient;
  }

  public Single<TsdbResponse> execute(TsdbRequest tsdbRequest) {
    return Single.defer(
        () -> {
          String body = OBJECT_MAPPER.writeValueAsString(tsdbRequest);
          LOG.debug("Sending {} queries to {}", tsdbRequest.getQueries().size(), queryUrl);
          Request request =
              new Request.Builder()
                  .url(queryUrl)
                  .post(RequestBody.create(body, JSON_MEDIA_TYPE))
                  .build();
          OkHttpResponseCallback callback = new OkHttpResponseCallback();
          okHttpClient.newCall(request).enqueue(callback);
          return Single.fromCompletionStage(callback.future).map(this::convertResponse);
        });
  }

  private TsdbResponse convertResponse(Response response) throws IOException {
    try (response) {
      ResponseBody responseBody = response.body();
      String content = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw CloudWatchRequestException.fromResponseBody(response.code(), content);
      }
      return TsdbResponse.fromJson(content);
    }
  }

  private static class OkHttpResponseCallback implements Callback {
    private final CompletableFuture<Response> future = new CompletableFuture<>();

    @Override
    public void onResponse(Call call, Response response) {
      future.complete(response);
    }

    @Override
    public void onFailure(Call call, IOException e) {
      future.completeExceptionally(e);
    }
  }
}
