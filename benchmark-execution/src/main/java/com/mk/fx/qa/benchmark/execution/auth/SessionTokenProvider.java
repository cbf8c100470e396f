package com.mk.fx.qa.benchmark.execution.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.benchmark.execution.exception.TokenRefreshException;
import com.mk.fx.qa.benchmark.rest.HttpMethod;
import com.mk.fx.qa.benchmark.rest.JsonUtil;
import com.mk.fx.qa.benchmark.rest.Request;
import com.mk.fx.qa.benchmark.rest.RestHttpClient;
import com.mk.fx.qa.benchmark.rest.RestTransportException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches session tokens from the instance's token endpoint and caches them.
 *
 * <p>A cached token is reused for {@link #CACHE_DURATION} after it was fetched, or until
 * {@link #REFRESH_THRESHOLD} before an explicit expiry reported by the endpoint, whichever comes
 * first. Methods are synchronized so concurrent callers never trigger parallel fetches.
 */
@Slf4j
public class SessionTokenProvider implements AuthTokenProvider {

  static final Duration CACHE_DURATION = Duration.ofMinutes(5);
  static final Duration REFRESH_THRESHOLD = Duration.ofSeconds(30);

  private final RestHttpClient client;
  private final String tokenEndpoint;
  private final Clock clock;

  private CachedToken cached;

  public SessionTokenProvider(RestHttpClient client, String tokenEndpoint) {
    this(client, tokenEndpoint, Clock.systemUTC());
  }

  SessionTokenProvider(RestHttpClient client, String tokenEndpoint, Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.tokenEndpoint = Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
    this.clock = clock;
  }

  @Override
  public AuthMode mode() {
    return AuthMode.TOKEN;
  }

  @Override
  public synchronized String currentToken() {
    if (isCachedTokenValid()) {
      log.debug("Using cached session token");
      return cached.token();
    }
    return fetchToken();
  }

  @Override
  public synchronized String refresh() {
    log.info("Force refreshing session token");
    cached = null;
    return fetchToken();
  }

  private boolean isCachedTokenValid() {
    if (cached == null) {
      return false;
    }
    var now = clock.instant();
    if (now.isAfter(cached.fetchedAt().plus(CACHE_DURATION))) {
      log.debug("Session token expired due to age");
      return false;
    }
    if (cached.expiresAt() != null && now.isAfter(cached.expiresAt().minus(REFRESH_THRESHOLD))) {
      log.debug("Session token will expire soon");
      return false;
    }
    return true;
  }

  private String fetchToken() {
    log.info("Fetching session token from {}", tokenEndpoint);
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setPath(tokenEndpoint);
    request.setHeaders(
        Map.of("Content-Type", "application/json", "X-Requested-With", "XMLHttpRequest"));

    JsonNode payload;
    try {
      var response = client.execute(request);
      if (!response.isSuccessful()) {
        throw new TokenRefreshException("Token fetch failed: HTTP " + response.getStatusCode());
      }
      payload = JsonUtil.readTree(response.getBody());
    } catch (RestTransportException e) {
      throw new TokenRefreshException("Token fetch failed: " + e.getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new TokenRefreshException("Token endpoint returned malformed JSON", e);
    }

    if (payload.hasNonNull("error")) {
      throw new TokenRefreshException("Token endpoint error: " + payload.get("error").asText());
    }
    // token may be nested under "result" or sit at the top level
    var token = textAt(payload, "token");
    if (token == null || token.isBlank()) {
      throw new TokenRefreshException("No token received from endpoint");
    }

    cached = new CachedToken(token, clock.instant(), parseExpiry(textAt(payload, "expires")));
    log.info("Session token fetched and cached");
    return token;
  }

  private static String textAt(JsonNode payload, String field) {
    var result = payload.path("result");
    if (result.hasNonNull(field)) {
      return result.get(field).asText();
    }
    return payload.hasNonNull(field) ? payload.get(field).asText() : null;
  }

  private static Instant parseExpiry(String expires) {
    if (expires == null || expires.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(expires);
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable token expiry '{}'", expires);
      return null;
    }
  }

  private record CachedToken(String token, Instant fetchedAt, Instant expiresAt) {}
}
