package com.mk.fx.qa.benchmark.execution.auth;

import com.mk.fx.qa.benchmark.rest.RestResponseData;

/**
 * Result of a gateway call.
 *
 * @param response the final transport response
 * @param session the session to use for subsequent calls, refreshed if a retry happened
 * @param retries how many auth retries were consumed to obtain {@code response}
 */
public record AuthenticatedResponse(RestResponseData response, AuthSession session, int retries) {}
