/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.llmauth.lib.http;

import com.google.common.annotations.VisibleForTesting;
import io.fleak.llmauth.api.errors.ConfigurationException;
import io.fleak.llmauth.api.errors.TransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thin wrapper around {@link HttpClient} used for the signing and token endpoints.
 *
 * <p>Makes exactly one attempt per call. Non-2xx responses are returned, not thrown; only network
 * failures raise {@link TransportException}, and a URL or header the JDK client refuses raises
 * {@link ConfigurationException}. Callers decide whether to retry.
 */
@Slf4j
public class SimpleHttpClient {

  public static final int MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

  private final HttpClient httpClient;
  private final LimitedSizeBodyHandler handler;
  private final Duration timeout;

  @VisibleForTesting
  public SimpleHttpClient(
      HttpClient httpClient, LimitedSizeBodyHandler handler, Duration timeout) {
    this.httpClient = httpClient;
    this.handler = handler;
    this.timeout = timeout;
  }

  public static SimpleHttpClient create(Duration timeout) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    return new SimpleHttpClient(
        httpClient, new LimitedSizeBodyHandler(MAX_RESPONSE_SIZE_BYTES), timeout);
  }

  public HttpResult post(
      @NonNull String url, String requestBody, @NonNull List<String> headerEntries) {
    HttpRequest request = buildRequest(url, requestBody, headerEntries);

    HttpResponse<String> httpResponse;
    try {
      httpResponse = httpClient.send(request, handler);
    } catch (IOException e) {
      log.debug("failed to invoke http(POST, {})", url, e);
      throw new TransportException("Request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Request interrupted: " + url, e);
    }

    int code = httpResponse.statusCode();
    if (code >= 400) {
      log.debug(
          "http response\ncode: {}\nbody: {}\nrequest: POST {}", code, httpResponse.body(), url);
    }
    return new HttpResult(code, httpResponse.body());
  }

  /** Anything the JDK builder rejects, a relative URL or a restricted header, is a config error. */
  private HttpRequest buildRequest(String url, String requestBody, List<String> headerEntries) {
    try {
      HttpRequest.Builder requestBuilder =
          HttpRequest.newBuilder()
              .uri(URI.create(url))
              .timeout(timeout)
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      Optional.ofNullable(requestBody).orElse("")));
      parseHeaders(headerEntries).forEach(requestBuilder::header);
      return requestBuilder.build();
    } catch (IllegalArgumentException e) {
      log.debug("cannot build http(POST, {})", url, e);
      throw new ConfigurationException("Invalid request: " + e.getMessage(), e);
    }
  }

  /** Parses {@code "Name: value"} entries, keeping their order. */
  static Map<String, String> parseHeaders(List<String> headers) {
    Map<String, String> parsed = new LinkedHashMap<>();
    for (String header : headers) {
      int colonPos = header.indexOf(':');
      if (colonPos <= 0) {
        throw new IllegalArgumentException("Invalid header format: " + header);
      }
      parsed.put(header.substring(0, colonPos).trim(), header.substring(colonPos + 1).trim());
    }
    return parsed;
  }
}
