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

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.AuthenticationResult;
import io.fleak.llmauth.api.credentials.AccessTokenCredentials;
import io.fleak.llmauth.api.credentials.ApiKeyCredentials;
import io.fleak.llmauth.api.errors.CredentialFormatException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ApiKeyStrategyTest {

  private final ApiKeyStrategy strategy =
      new ApiKeyStrategy("https://generativelanguage.googleapis.com/v1beta/");

  @Test
  void authenticate() {
    AuthenticationResult result = strategy.authenticate(new ApiKeyCredentials("sk-live-123"));

    assertEquals(AuthenticationResult.AuthType.API_KEY, result.getAuthType());
    assertEquals("sk-live-123", result.getToken());
    assertEquals(AuthStrategyKind.API_KEY, strategy.kind());
  }

  @Test
  void authenticate_blankKey() {
    CredentialFormatException e =
        assertThrows(
            CredentialFormatException.class,
            () -> strategy.authenticate(new ApiKeyCredentials("  ")));
    assertEquals("Invalid API key", e.getMessage());
  }

  @Test
  void authenticate_wrongCredentialFamily() {
    assertThrows(
        CredentialFormatException.class,
        () -> strategy.authenticate(new AccessTokenCredentials("tok", "p", "l")));
  }

  @Test
  void headers() {
    assertEquals(
        List.of(
            new AuthHeader("Content-Type", "application/json"),
            new AuthHeader("Authorization", "Bearer sk-live-123"),
            new AuthHeader("x-goog-api-key", "sk-live-123")),
        strategy.headers(new ApiKeyCredentials("sk-live-123")));
  }

  @Test
  void baseUrlAndPaths() {
    ApiKeyCredentials credentials = new ApiKeyCredentials("k");

    assertEquals(
        "https://generativelanguage.googleapis.com/v1beta", strategy.baseUrl(credentials));
    assertEquals(
        "models/gemini-pro:generateContent",
        strategy.buildPath("gemini-pro", "generateContent", credentials));
    assertEquals(
        "models/gemini-pro:countTokens",
        strategy.buildPath("models/gemini-pro", "countTokens", credentials));
    assertEquals("models", strategy.modelsPath(credentials));
  }

  @Test
  void refreshCredentials_returnsSameKey() {
    ApiKeyCredentials credentials = new ApiKeyCredentials("k");

    assertSame(credentials, strategy.refreshCredentials(credentials));
  }
}
