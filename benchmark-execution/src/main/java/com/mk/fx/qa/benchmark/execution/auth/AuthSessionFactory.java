package com.mk.fx.qa.benchmark.execution.auth;

import com.mk.fx.qa.benchmark.execution.exception.TokenRefreshException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Opens the initial session of a run from the configured authentication settings. */
@Slf4j
public class AuthSessionFactory {

  private final AuthMode mode;
  private final String username;
  private final String password;
  private final String baseUrl;
  private final AuthTokenProvider tokenProvider;

  public AuthSessionFactory(
      AuthMode mode,
      String username,
      String password,
      String baseUrl,
      AuthTokenProvider tokenProvider) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.username = username;
    this.password = password;
    this.baseUrl = baseUrl;
    this.tokenProvider = tokenProvider;
  }

  /**
   * @throws IllegalArgumentException if credential mode lacks a username or password
   * @throws TokenRefreshException if token mode cannot obtain a token
   */
  public AuthSession open() {
    if (mode == AuthMode.CREDENTIAL) {
      return AuthSession.credential(username, password, baseUrl);
    }
    if (tokenProvider == null) {
      throw new TokenRefreshException("No token provider configured for token mode");
    }
    log.debug("Opening token session");
    return AuthSession.token(tokenProvider.currentToken());
  }

  public AuthMode mode() {
    return mode;
  }
}
