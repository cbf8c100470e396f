package com.mk.fx.qa.benchmark.execution.auth;

import java.util.Objects;

/**
 * Immutable authentication state for one run. A token refresh never mutates a session; it yields
 * a new one through {@link #withToken(String)} which the caller threads into later calls.
 *
 * @param mode credential or token authentication
 * @param credentialOrToken {@code user:password} in credential mode, the session token otherwise
 * @param baseUrl instance URL used for credential mode dispatch, may be empty in token mode
 */
public record AuthSession(AuthMode mode, String credentialOrToken, String baseUrl) {

  public AuthSession {
    Objects.requireNonNull(mode, "mode");
    credentialOrToken = credentialOrToken == null ? "" : credentialOrToken;
    baseUrl = baseUrl == null ? "" : baseUrl;
  }

  public static AuthSession credential(String username, String password, String baseUrl) {
    if (username == null || username.isBlank() || password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Username and password required for credential mode");
    }
    return new AuthSession(AuthMode.CREDENTIAL, username + ":" + password, baseUrl);
  }

  public static AuthSession token(String token) {
    return new AuthSession(AuthMode.TOKEN, token, "");
  }

  public AuthSession withToken(String token) {
    return new AuthSession(mode, token, baseUrl);
  }

  @Override
  public String toString() {
    return "AuthSession[mode=" + mode + ", baseUrl=" + baseUrl + ", secret=***]";
  }
}
