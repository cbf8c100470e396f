package com.mk.fx.qa.benchmark.execution.auth;

import com.mk.fx.qa.benchmark.execution.exception.AuthFailedException;
import com.mk.fx.qa.benchmark.execution.exception.NetworkException;
import com.mk.fx.qa.benchmark.execution.exception.TokenRefreshException;
import com.mk.fx.qa.benchmark.execution.exception.ValidationException;
import com.mk.fx.qa.benchmark.execution.request.RequestDescriptor;
import com.mk.fx.qa.benchmark.rest.Request;
import com.mk.fx.qa.benchmark.rest.RestHttpClient;
import com.mk.fx.qa.benchmark.rest.RestResponseData;
import com.mk.fx.qa.benchmark.rest.RestTransportException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches request descriptors with authentication attached.
 *
 * <p>An unauthorized or forbidden status in token mode triggers a synchronous token refresh and a
 * retry of the same descriptor, at most {@value #MAX_AUTH_RETRIES} times per call. Transport
 * failures are reported as {@link NetworkException} and never retried here.
 */
@Slf4j
public class AuthGateway {

  static final int MAX_AUTH_RETRIES = 2;

  private final RestHttpClient client;
  private final AuthTokenProvider tokenProvider;

  public AuthGateway(RestHttpClient client, AuthTokenProvider tokenProvider) {
    this.client = Objects.requireNonNull(client, "client");
    this.tokenProvider = tokenProvider;
  }

  /**
   * Executes {@code descriptor} with {@code session}.
   *
   * @return the response together with the session to use from now on
   * @throws ValidationException if the descriptor carries validation errors
   * @throws AuthFailedException if the instance keeps rejecting the call
   * @throws NetworkException if the call could not be exchanged
   * @throws TokenRefreshException if a refresh was needed but failed
   */
  public AuthenticatedResponse execute(RequestDescriptor descriptor, AuthSession session) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(session, "session");
    if (!descriptor.isValid()) {
      throw new ValidationException("Request is invalid: " + descriptor.describeErrors());
    }

    var current = session;
    var retries = 0;
    while (true) {
      var request = toRequest(descriptor, current);
      var response = dispatch(request);
      var status = response.getStatusCode();

      if (status != 401 && status != 403) {
        return new AuthenticatedResponse(response, current, retries);
      }
      if (current.mode() == AuthMode.TOKEN && retries < MAX_AUTH_RETRIES) {
        log.warn(
            "Authentication failed with status {} for {}, refreshing token and retrying ({}/{})",
            status,
            request.getPath(),
            retries + 1,
            MAX_AUTH_RETRIES);
        current = current.withToken(refreshToken());
        retries++;
        continue;
      }
      throw new AuthFailedException("Authentication failed: HTTP " + status);
    }
  }

  private RestResponseData dispatch(Request request) {
    try {
      return client.execute(request);
    } catch (RestTransportException e) {
      throw new NetworkException(
          e.isTimedOut() ? "Request timed out: " + request.getPath() : "Network error occurred",
          e);
    }
  }

  private String refreshToken() {
    if (tokenProvider == null) {
      throw new TokenRefreshException("No token provider configured for token mode");
    }
    try {
      return tokenProvider.refresh();
    } catch (TokenRefreshException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TokenRefreshException("Failed to refresh session token: " + e.getMessage(), e);
    }
  }

  Request toRequest(RequestDescriptor descriptor, AuthSession session) {
    Map<String, String> headers = new HashMap<>();
    headers.put("Accept", "application/json");
    headers.put("Content-Type", "application/json");
    headers.putAll(descriptor.headers());

    String path;
    if (session.mode() == AuthMode.TOKEN) {
      headers.put("X-UserToken", session.credentialOrToken());
      headers.put("X-Requested-With", "XMLHttpRequest");
      path = relativePath(descriptor.target());
    } else {
      var encoded =
          Base64.getEncoder()
              .encodeToString(session.credentialOrToken().getBytes(StandardCharsets.UTF_8));
      headers.put("Authorization", "Basic " + encoded);
      path = absoluteUrl(session.baseUrl(), descriptor.target());
    }

    var request = new Request();
    request.setMethod(descriptor.method());
    request.setPath(path);
    request.setHeaders(headers);
    request.setBody(descriptor.body());
    return request;
  }

  private static String relativePath(String target) {
    if (isAbsolute(target)) {
      var uri = URI.create(target);
      var query = uri.getRawQuery();
      return query == null ? uri.getRawPath() : uri.getRawPath() + "?" + query;
    }
    return target.startsWith("/") ? target : "/" + target;
  }

  private static String absoluteUrl(String baseUrl, String target) {
    if (isAbsolute(target) || baseUrl.isEmpty()) {
      return target;
    }
    var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return base + (target.startsWith("/") ? target : "/" + target);
  }

  private static boolean isAbsolute(String target) {
    return target.startsWith("http://") || target.startsWith("https://");
  }
}
