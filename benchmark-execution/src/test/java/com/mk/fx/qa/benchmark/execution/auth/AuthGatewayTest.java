package com.mk.fx.qa.benchmark.execution.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.benchmark.execution.exception.AuthFailedException;
import com.mk.fx.qa.benchmark.execution.exception.NetworkException;
import com.mk.fx.qa.benchmark.execution.exception.TokenRefreshException;
import com.mk.fx.qa.benchmark.execution.exception.ValidationException;
import com.mk.fx.qa.benchmark.execution.request.RequestDescriptor;
import com.mk.fx.qa.benchmark.execution.request.ValidationError;
import com.mk.fx.qa.benchmark.rest.HttpMethod;
import com.mk.fx.qa.benchmark.rest.Request;
import com.mk.fx.qa.benchmark.rest.RestHttpClient;
import com.mk.fx.qa.benchmark.rest.RestResponseData;
import com.mk.fx.qa.benchmark.rest.RestTransportException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthGatewayTest {

  private RestHttpClient client;
  private AuthTokenProvider tokenProvider;
  private final List<Request> sent = new ArrayList<>();

  private static final RequestDescriptor FETCH =
      new RequestDescriptor(
          HttpMethod.GET, "api/now/table/incident?sysparm_limit=5", Map.of(), null, List.of());

  @BeforeEach
  void setUp() {
    client = mock(RestHttpClient.class);
    tokenProvider = mock(AuthTokenProvider.class);
  }

  private void respondWith(int... statuses) {
    var responses = new ArrayList<RestResponseData>();
    for (int status : statuses) {
      responses.add(response(status));
    }
    var index = new int[] {0};
    when(client.execute(any()))
        .thenAnswer(
            invocation -> {
              sent.add(invocation.getArgument(0));
              var i = Math.min(index[0]++, responses.size() - 1);
              return responses.get(i);
            });
  }

  private static RestResponseData response(int status) {
    var data = new RestResponseData();
    data.setStatusCode(status);
    data.setBody("{\"result\":[]}");
    data.setHeaders(Map.of());
    return data;
  }

  @Test
  void tokenMode_refreshesOnceAndRetriesAfterUnauthorized() {
    respondWith(401, 200);
    when(tokenProvider.refresh()).thenReturn("fresh");
    var gateway = new AuthGateway(client, tokenProvider);

    var result = gateway.execute(FETCH, AuthSession.token("stale"));

    assertThat(result.response().getStatusCode()).isEqualTo(200);
    assertThat(result.retries()).isEqualTo(1);
    assertThat(result.session().credentialOrToken()).isEqualTo("fresh");
    assertThat(sent).hasSize(2);
    assertThat(sent.get(0).getHeaders()).containsEntry("X-UserToken", "stale");
    assertThat(sent.get(1).getHeaders()).containsEntry("X-UserToken", "fresh");
    assertThat(sent.get(1).getPath()).isEqualTo("/api/now/table/incident?sysparm_limit=5");
    verify(tokenProvider, times(1)).refresh();
  }

  @Test
  void tokenMode_givesUpAfterMaxRetries() {
    respondWith(403);
    when(tokenProvider.refresh()).thenReturn("again");
    var gateway = new AuthGateway(client, tokenProvider);

    assertThatThrownBy(() -> gateway.execute(FETCH, AuthSession.token("t")))
        .isInstanceOf(AuthFailedException.class)
        .hasMessageContaining("403");
    assertThat(sent).hasSize(AuthGateway.MAX_AUTH_RETRIES + 1);
  }

  @Test
  void credentialMode_failsWithoutRefresh() {
    respondWith(401);
    var gateway = new AuthGateway(client, tokenProvider);

    assertThatThrownBy(
            () ->
                gateway.execute(
                    FETCH, AuthSession.credential("admin", "secret", "https://dev.example.com")))
        .isInstanceOf(AuthFailedException.class);
    verify(tokenProvider, never()).refresh();
  }

  @Test
  void credentialMode_sendsBasicAuthToAbsoluteUrl() {
    respondWith(200);
    var gateway = new AuthGateway(client, tokenProvider);

    var result =
        gateway.execute(FETCH, AuthSession.credential("admin", "secret", "https://dev.example.com/"));

    var expected =
        "Basic "
            + Base64.getEncoder().encodeToString("admin:secret".getBytes(StandardCharsets.UTF_8));
    assertThat(result.retries()).isZero();
    assertThat(sent.get(0).getHeaders()).containsEntry("Authorization", expected);
    assertThat(sent.get(0).getPath())
        .isEqualTo("https://dev.example.com/api/now/table/incident?sysparm_limit=5");
  }

  @Test
  void errorStatusOtherThanAuthIsReturned() {
    respondWith(500);
    var gateway = new AuthGateway(client, tokenProvider);

    var result = gateway.execute(FETCH, AuthSession.token("t"));

    assertThat(result.response().getStatusCode()).isEqualTo(500);
    assertThat(result.retries()).isZero();
  }

  @Test
  void transportFailureBecomesNetworkException() {
    when(client.execute(any()))
        .thenThrow(
            new RestTransportException("timed out", new HttpTimeoutException("slow"), true));
    var gateway = new AuthGateway(client, tokenProvider);

    assertThatThrownBy(() -> gateway.execute(FETCH, AuthSession.token("t")))
        .isInstanceOf(NetworkException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void failedRefreshSurfacesAsTokenRefreshException() {
    respondWith(401);
    when(tokenProvider.refresh()).thenThrow(new IllegalStateException("endpoint down"));
    var gateway = new AuthGateway(client, tokenProvider);

    assertThatThrownBy(() -> gateway.execute(FETCH, AuthSession.token("t")))
        .isInstanceOf(TokenRefreshException.class)
        .hasMessageContaining("endpoint down");
  }

  @Test
  void invalidDescriptorIsNeverDispatched() {
    var gateway = new AuthGateway(client, tokenProvider);
    var invalid = RequestDescriptor.invalid(List.of(new ValidationError("table", "required")));

    assertThatThrownBy(() -> gateway.execute(invalid, AuthSession.token("t")))
        .isInstanceOf(ValidationException.class);
    verify(client, never()).execute(any());
  }
}
