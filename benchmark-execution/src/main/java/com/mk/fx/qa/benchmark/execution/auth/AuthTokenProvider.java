package com.mk.fx.qa.benchmark.execution.auth;

import com.mk.fx.qa.benchmark.execution.exception.TokenRefreshException;

/** Narrow view of the session-token source the {@link AuthGateway} depends on. */
public interface AuthTokenProvider {

  AuthMode mode();

  /** Returns a usable token, fetching one if nothing valid is cached. */
  String currentToken() throws TokenRefreshException;

  /** Discards any cached token and fetches a new one. */
  String refresh() throws TokenRefreshException;
}
