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
package io.fleak.llmauth.lib.strategy;

import com.google.common.base.Preconditions;
import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.AuthStrategy;
import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.AuthenticationResult;
import io.fleak.llmauth.api.credentials.ApiKeyCredentials;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.errors.CredentialFormatException;
import java.util.List;
import java.util.Objects;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;

/**
 * Gemini API: the API key is sent as a bearer token and repeated in {@code x-goog-api-key}. It
 * never expires.
 */
public class ApiKeyStrategy implements AuthStrategy {

  public static final String API_KEY_HEADER = "x-goog-api-key";

  private final String baseUrl;

  public ApiKeyStrategy(@NonNull String baseUrl) {
    this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
  }

  @Override
  public AuthStrategyKind kind() {
    return AuthStrategyKind.API_KEY;
  }

  @Override
  public AuthenticationResult authenticate(Credentials credentials) {
    ApiKeyCredentials apiKey = apiKey(credentials);
    if (StringUtils.isBlank(apiKey.key())) {
      throw new CredentialFormatException("Invalid API key");
    }
    return AuthenticationResult.builder()
        .authType(AuthenticationResult.AuthType.API_KEY)
        .token(apiKey.key())
        .build();
  }

  @Override
  public List<AuthHeader> headers(Credentials credentials) {
    String key = Objects.toString(apiKey(credentials).key(), "");
    return List.of(
        AuthHeader.jsonContentType(), AuthHeader.bearer(key), new AuthHeader(API_KEY_HEADER, key));
  }

  @Override
  public String baseUrl(Credentials credentials) {
    return baseUrl;
  }

  @Override
  public String buildPath(String model, String endpoint, Credentials credentials) {
    Preconditions.checkNotNull(model, "model is required");
    Preconditions.checkNotNull(endpoint, "endpoint is required");
    return ModelPaths.normalizeModel(model) + ":" + endpoint;
  }

  @Override
  public String modelsPath(Credentials credentials) {
    return ModelPaths.MODELS;
  }

  @Override
  public Credentials refreshCredentials(Credentials credentials) {
    return apiKey(credentials);
  }

  private static ApiKeyCredentials apiKey(Credentials credentials) {
    if (credentials instanceof ApiKeyCredentials apiKey) {
      return apiKey;
    }
    throw new CredentialFormatException(
        "Gemini API key strategy cannot use "
            + (credentials == null ? "null credentials" : credentials.type() + " credentials"));
  }
}
