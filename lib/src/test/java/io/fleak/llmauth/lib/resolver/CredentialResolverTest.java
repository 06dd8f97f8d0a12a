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
package io.fleak.llmauth.lib.resolver;

import static io.fleak.llmauth.lib.TestUtils.envOf;
import static org.junit.jupiter.api.Assertions.*;

import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.credentials.AccessTokenCredentials;
import io.fleak.llmauth.api.credentials.ApiKeyCredentials;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.credentials.ServiceAccountDataCredentials;
import io.fleak.llmauth.api.credentials.ServiceAccountKeyFileCredentials;
import io.fleak.llmauth.api.errors.ConfigurationException;
import io.fleak.llmauth.api.errors.ErrorType;
import io.fleak.llmauth.lib.config.AuthOptions;
import io.fleak.llmauth.lib.config.AuthSettings;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialResolverTest {

  private Map<String, String> env;
  private AuthSettings settings;
  private CredentialResolver resolver;

  @BeforeEach
  void setUp() {
    env = new HashMap<>();
    settings = AuthSettings.defaults();
    resolver = new CredentialResolver(settings, envOf(env));
  }

  @Test
  void apiKey_optionsWinOverEnvAndSettings() {
    env.put("GEMINI_API_KEY", "env-key");
    settings.setGeminiApiKey("settings-key");

    Credentials credentials =
        resolver.resolve(AuthStrategyKind.API_KEY, AuthOptions.builder().apiKey("opt-key").build());

    assertEquals(new ApiKeyCredentials("opt-key"), credentials);
  }

  @Test
  void apiKey_envWinsOverSettings() {
    env.put("GEMINI_API_KEY", "env-key");
    settings.setGeminiApiKey("settings-key");

    assertEquals(
        new ApiKeyCredentials("env-key"), resolver.resolve(AuthStrategyKind.API_KEY, null));
  }

  @Test
  void apiKey_fallsBackToSettings() {
    settings.setGeminiApiKey("settings-key");

    assertEquals(
        new ApiKeyCredentials("settings-key"),
        resolver.resolve(AuthStrategyKind.API_KEY, AuthOptions.NONE));
  }

  @Test
  void apiKey_missing() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> resolver.resolve(AuthStrategyKind.API_KEY, AuthOptions.NONE));
    assertEquals("Missing or invalid Gemini API key", e.getMessage());
    assertEquals(ErrorType.CONFIGURATION, e.getErrorType());
  }

  @Test
  void apiKey_blankOptionDoesNotFallThrough() {
    env.put("GEMINI_API_KEY", "env-key");

    assertThrows(
        ConfigurationException.class,
        () -> resolver.resolve(AuthStrategyKind.API_KEY, AuthOptions.builder().apiKey("").build()));
  }

  @Test
  void serviceAccount_projectAndLocationPrecedence() {
    env.put("GOOGLE_CLOUD_PROJECT", "gcp-project");
    env.put("VERTEX_PROJECT_ID", "vertex-project");
    env.put("GOOGLE_CLOUD_LOCATION", "asia-east1");
    env.put("VERTEX_ACCESS_TOKEN", "env-token");

    Credentials credentials = resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null);

    assertEquals(new AccessTokenCredentials("env-token", "vertex-project", "asia-east1"), credentials);
  }

  @Test
  void serviceAccount_locationDefaultsToUsCentral1() {
    AccessTokenCredentials credentials =
        (AccessTokenCredentials)
            resolver.resolve(
                AuthStrategyKind.SERVICE_ACCOUNT,
                AuthOptions.builder().projectId("p").accessToken("tok").build());

    assertEquals("us-central1", credentials.location());
  }

  @Test
  void serviceAccount_missingProject() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () ->
                resolver.resolve(
                    AuthStrategyKind.SERVICE_ACCOUNT,
                    AuthOptions.builder().accessToken("tok").build()));
    assertEquals("Missing Vertex AI project_id", e.getMessage());
  }

  @Test
  void serviceAccount_blankLocation() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () ->
                resolver.resolve(
                    AuthStrategyKind.SERVICE_ACCOUNT,
                    AuthOptions.builder().projectId("p").location(" ").accessToken("t").build()));
    assertEquals("Missing Vertex AI location", e.getMessage());
  }

  @Test
  void serviceAccount_optionAccessTokenBeatsKeyFile() {
    env.put("VERTEX_SERVICE_ACCOUNT", "/keys/sa.json");

    Credentials credentials =
        resolver.resolve(
            AuthStrategyKind.SERVICE_ACCOUNT,
            AuthOptions.builder().projectId("p").accessToken("opt-token").build());

    assertEquals(new AccessTokenCredentials("opt-token", "p", "us-central1"), credentials);
  }

  @Test
  void serviceAccount_envAccessTokenBeatsEnvKeyFile() {
    env.put("VERTEX_PROJECT_ID", "p");
    env.put("VERTEX_ACCESS_TOKEN", "env-token");
    env.put("VERTEX_JSON_FILE", "/keys/json-file.json");
    env.put("VERTEX_SERVICE_ACCOUNT", "/keys/sa.json");

    assertEquals(
        new AccessTokenCredentials("env-token", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));

    env.remove("VERTEX_ACCESS_TOKEN");
    assertEquals(
        new ServiceAccountKeyFileCredentials("/keys/sa.json", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));

    env.remove("VERTEX_SERVICE_ACCOUNT");
    assertEquals(
        new ServiceAccountKeyFileCredentials("/keys/json-file.json", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));
  }

  @Test
  void serviceAccount_optionKeyFileAndDataBeatEnvAccessToken() {
    env.put("VERTEX_PROJECT_ID", "p");
    env.put("VERTEX_ACCESS_TOKEN", "env-token");

    assertEquals(
        new ServiceAccountKeyFileCredentials("/keys/opt.json", "p", "us-central1"),
        resolver.resolve(
            AuthStrategyKind.SERVICE_ACCOUNT,
            AuthOptions.builder().serviceAccountKeyPath("/keys/opt.json").build()));
    assertEquals(
        new ServiceAccountDataCredentials(Map.of("client_email", "a@b"), "p", "us-central1"),
        resolver.resolve(
            AuthStrategyKind.SERVICE_ACCOUNT,
            AuthOptions.builder().serviceAccountData(Map.of("client_email", "a@b")).build()));
  }

  @Test
  void serviceAccount_settingsAuthIgnoredWhenEnvNamesAMethod() {
    env.put("VERTEX_PROJECT_ID", "p");
    env.put("VERTEX_SERVICE_ACCOUNT", "/keys/sa.json");
    settings.getVertex().setServiceAccountKeyPath("/keys/settings.json");
    settings.getVertex().setServiceAccountData(Map.of("client_email", "a@b"));
    settings.getVertex().setAccessToken("settings-token");

    assertEquals(
        new ServiceAccountKeyFileCredentials("/keys/sa.json", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));

    env.remove("VERTEX_SERVICE_ACCOUNT");
    env.put("VERTEX_ACCESS_TOKEN", "env-token");
    assertEquals(
        new AccessTokenCredentials("env-token", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));

    env.remove("VERTEX_ACCESS_TOKEN");
    assertEquals(
        new ServiceAccountKeyFileCredentials("/keys/settings.json", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));
  }

  @Test
  void serviceAccount_inlineDataFromSettings() {
    settings.getVertex().setProjectId("settings-project");
    settings.getVertex().setLocation("europe-west4");
    settings.getVertex().setServiceAccountData(Map.of("client_email", "a@b"));

    ServiceAccountDataCredentials credentials =
        (ServiceAccountDataCredentials) resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null);

    assertEquals("settings-project", credentials.projectId());
    assertEquals("europe-west4", credentials.location());
    assertEquals("a@b", credentials.data().get("client_email"));
  }

  @Test
  void serviceAccount_applicationDefaultCredentialsAreLastResort() {
    env.put("VERTEX_PROJECT_ID", "p");
    env.put("GOOGLE_APPLICATION_CREDENTIALS", "/adc.json");

    assertEquals(
        new ServiceAccountKeyFileCredentials("/adc.json", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));

    env.put("VERTEX_ACCESS_TOKEN", "env-token");
    assertEquals(
        new AccessTokenCredentials("env-token", "p", "us-central1"),
        resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));
  }

  @Test
  void serviceAccount_noAuthMethod() {
    env.put("VERTEX_PROJECT_ID", "p");

    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> resolver.resolve(AuthStrategyKind.SERVICE_ACCOUNT, null));
    assertEquals("Missing Vertex AI authentication method", e.getMessage());
  }

  @Test
  void environmentIsReadOnEveryCall() {
    assertThrows(
        ConfigurationException.class, () -> resolver.resolve(AuthStrategyKind.API_KEY, null));

    env.put("GEMINI_API_KEY", "late-key");

    assertEquals(new ApiKeyCredentials("late-key"), resolver.resolve(AuthStrategyKind.API_KEY, null));
  }
}
