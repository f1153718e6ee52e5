package org.hypertrace.core.cloudwatch.query.tsdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

/**
 * Failure reported by the query endpoint. The {@link ErrorType} tells callers whether the backend
 * rejected the request as invalid or throttled it, so that they can notify the user accordingly.
 */
@Getter
public class CloudWatchRequestException extends RuntimeException {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final String VALIDATION_ERROR_PREFIX = "ValidationError:";
  private static final String THROTTLING_ERROR_PREFIX = "Throttling:";

  public enum ErrorType {
    VALIDATION,
    THROTTLING,
    GENERIC
  }

  private final int statusCode;
  private final String error;
  private final ErrorType errorType;

  public CloudWatchRequestException(int statusCode, String error) {
    super(String.format("CloudWatch query request failed with status %d: %s", statusCode, error));
    this.statusCode = statusCode;
    this.error = error;
    this.errorType = classify(error);
  }

  /** Extracts the error string from an error body of the form {@code {"error": ...}}. */
  static CloudWatchRequestException fromResponseBody(int statusCode, String body) {
    return new CloudWatchRequestException(statusCode, extractError(body));
  }

  private static String extractError(String body) {
    try {
      JsonNode node = OBJECT_MAPPER.readTree(body);
      if (node == null) {
        return body;
      }
      JsonNode error = node.path("data").path("error");
      if (error.isMissingNode()) {
        error = node.path("error");
      }
      return error.isMissingNode() || error.isNull() ? body : error.asText();
    } catch (JsonProcessingException e) {
      // not a json body, e.g. a proxy error page
      return body;
    }
  }

  private static ErrorType classify(String error) {
    if (error == null) {
      return ErrorType.GENERIC;
    }
    if (error.startsWith(VALIDATION_ERROR_PREFIX)) {
      return ErrorType.VALIDATION;
    }
    if (error.startsWith(THROTTLING_ERROR_PREFIX)) {
      return ErrorType.THROTTLING;
    }
    return ErrorType.GENERIC;
  }
}
