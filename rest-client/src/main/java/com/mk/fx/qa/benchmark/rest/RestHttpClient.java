package com.mk.fx.qa.benchmark.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for executing JSON requests described by a {@link Request}. Supports a base URL for
 * relative paths, global header management and timeout configuration. This implementation does
 * not include retry logic; callers decide what to do with error statuses and transport failures.
 */
@Slf4j
public class RestHttpClient {

  /** Default request timeout in seconds. */
  public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL that relative request paths are resolved against. */
  private final String baseUrl;

  /** Timeout duration for requests. */
  private final Duration requestTimeout;

  /**
   * Constructs a client with the default request timeout and no global headers.
   *
   * @param baseUrl the base URL for relative requests
   * @param connTimeOutSeconds connection timeout in seconds
   */
  public RestHttpClient(String baseUrl, int connTimeOutSeconds) {
    this(baseUrl, connTimeOutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS, Map.of());
  }

  /**
   * Constructs a client with a specified request timeout.
   *
   * @param baseUrl the base URL for relative requests
   * @param connTimeOutSeconds connection timeout in seconds
   * @param requestTimeoutSeconds request timeout in seconds, bounding every single exchange
   * @param headers global headers to include in all requests
   */
  public RestHttpClient(
      String baseUrl, int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(connTimeOutSeconds)).build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "RestHttpClient initialised - Base URL: {}, Connection timeout: {}s, Request timeout: {}s",
        this.baseUrl,
        connTimeOutSeconds,
        requestTimeoutSeconds);
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Executes a synchronous request. The response body is read fully before this method returns,
   * so {@link RestResponseData#getResponseTimeMs()} covers dispatch to last byte.
   *
   * @param request the request to execute
   * @return the response data, whatever its status code
   * @throws RestTransportException if the exchange could not complete
   */
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);

    try {
      var startTime = System.nanoTime();
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;

      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);

    } catch (HttpTimeoutException e) {
      log.error(
          "Request timed out after {} seconds: {}", requestTimeout.getSeconds(), e.getMessage());
      throw new RestTransportException(
          "Request timed out after " + requestTimeout.getSeconds() + "s: " + e.getMessage(),
          e,
          true);
    } catch (IOException e) {
      log.error("Error executing request to {}: {}", httpRequest.uri(), e.getMessage());
      throw new RestTransportException("Error executing request: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RestTransportException("Request interrupted", e);
    }
  }

  /**
   * Resolves a request path against the base URL. Absolute {@code http(s)} paths are used as-is.
   */
  String resolveUrl(String path) {
    if (path == null || path.isEmpty()) {
      return baseUrl;
    }
    if (path.startsWith("http://") || path.startsWith("https://")) {
      return path;
    }
    return baseUrl + (path.startsWith("/") ? path : "/" + path);
  }

  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new IllegalArgumentException("Request method is required");
    }
    var requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(resolveUrl(request.getPath()))).timeout(requestTimeout);

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody =
            request.getBody() instanceof String raw ? raw : JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .setHeader("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Failed to serialize request body: " + e.getMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }

    return requestBuilder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
