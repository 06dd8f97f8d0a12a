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

import static io.fleak.llmauth.lib.utils.MiscUtils.firstPresent;

import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.credentials.AccessTokenCredentials;
import io.fleak.llmauth.api.credentials.ApiKeyCredentials;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.credentials.ServiceAccountDataCredentials;
import io.fleak.llmauth.api.credentials.ServiceAccountKeyFileCredentials;
import io.fleak.llmauth.api.errors.ConfigurationException;
import io.fleak.llmauth.lib.config.AuthEnvironment;
import io.fleak.llmauth.lib.config.AuthOptions;
import io.fleak.llmauth.lib.config.AuthSettings;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the credential bundle for a strategy from three layers, highest precedence first:
 * per-call {@link AuthOptions}, process environment, static {@link AuthSettings}.
 *
 * <p>A null value is absent and falls through to the next layer. A present but blank value is
 * taken as is and then rejected.
 *
 * <p>Service account authentication methods are tried in this order, stopping at the first present
 * value:
 *
 * <ol>
 *   <li>per-call access token
 *   <li>key file path: per-call, then the configured default
 *   <li>inline key data: per-call, then the configured default
 *   <li>the configured default access token
 *   <li>{@code GOOGLE_APPLICATION_CREDENTIALS}
 * </ol>
 *
 * The configured default is a single method: {@code VERTEX_ACCESS_TOKEN} if set, else the key file
 * named by {@code VERTEX_SERVICE_ACCOUNT} or {@code VERTEX_JSON_FILE}, else whatever the settings
 * hold. Settings are ignored for the authentication method once the environment names one.
 *
 * The environment is read fresh on every call.
 */
@Slf4j
public class CredentialResolver {

  private final AuthSettings settings;
  private final UnaryOperator<String> getenv;

  public CredentialResolver(@NonNull AuthSettings settings) {
    this(settings, System::getenv);
  }

  public CredentialResolver(@NonNull AuthSettings settings, @NonNull UnaryOperator<String> getenv) {
    this.settings = settings;
    this.getenv = getenv;
  }

  public Credentials resolve(@NonNull AuthStrategyKind kind, AuthOptions options) {
    AuthOptions opts = options == null ? AuthOptions.NONE : options;
    AuthEnvironment env = AuthEnvironment.capture(getenv);
    return switch (kind) {
      case API_KEY -> resolveApiKey(opts, env);
      case SERVICE_ACCOUNT -> resolveServiceAccount(opts, env);
    };
  }

  private ApiKeyCredentials resolveApiKey(AuthOptions opts, AuthEnvironment env) {
    String key = firstPresent(opts.getApiKey(), env.geminiApiKey(), settings.getGeminiApiKey());
    if (StringUtils.isBlank(key)) {
      throw new ConfigurationException("Missing or invalid Gemini API key");
    }
    log.debug("resolved Gemini API key from {}", apiKeySource(opts, env));
    return new ApiKeyCredentials(key);
  }

  private Credentials resolveServiceAccount(AuthOptions opts, AuthEnvironment env) {
    AuthSettings.VertexSettings vertex = vertexSettings();

    String projectId =
        firstPresent(
            opts.getProjectId(),
            env.vertexProjectId(),
            env.googleCloudProject(),
            vertex.getProjectId());
    String location =
        firstPresent(
            opts.getLocation(),
            env.vertexLocation(),
            env.googleCloudLocation(),
            vertex.getLocation(),
            AuthSettings.DEFAULT_LOCATION);

    if (StringUtils.isBlank(projectId)) {
      throw new ConfigurationException("Missing Vertex AI project_id");
    }
    if (StringUtils.isBlank(location)) {
      throw new ConfigurationException("Missing Vertex AI location");
    }

    if (opts.getAccessToken() != null) {
      log.debug("resolved Vertex AI access token from request options");
      return new AccessTokenCredentials(opts.getAccessToken(), projectId, location);
    }

    AuthMethodDefaults defaults = authMethodDefaults(env, vertex);

    String keyPath = firstPresent(opts.getServiceAccountKeyPath(), defaults.keyPath());
    if (keyPath != null) {
      log.debug("resolved Vertex AI service account key file {}", keyPath);
      return new ServiceAccountKeyFileCredentials(keyPath, projectId, location);
    }

    Map<String, Object> keyData = firstPresent(opts.getServiceAccountData(), defaults.keyData());
    if (keyData != null) {
      log.debug("resolved Vertex AI inline service account data");
      return new ServiceAccountDataCredentials(keyData, projectId, location);
    }

    if (defaults.accessToken() != null) {
      log.debug("resolved Vertex AI access token from {}", defaults.source());
      return new AccessTokenCredentials(defaults.accessToken(), projectId, location);
    }

    if (env.googleApplicationCredentials() != null) {
      log.debug(
          "resolved Vertex AI key file from {}: {}",
          AuthEnvironment.GOOGLE_APPLICATION_CREDENTIALS,
          env.googleApplicationCredentials());
      return new ServiceAccountKeyFileCredentials(
          env.googleApplicationCredentials(), projectId, location);
    }

    throw new ConfigurationException("Missing Vertex AI authentication method");
  }

  /**
   * The authentication method configured outside the call. {@code VERTEX_ACCESS_TOKEN} wins over
   * the key file variables, and settings only count when neither is set.
   */
  private static AuthMethodDefaults authMethodDefaults(
      AuthEnvironment env, AuthSettings.VertexSettings vertex) {
    if (env.vertexAccessToken() != null) {
      return new AuthMethodDefaults(
          AuthEnvironment.VERTEX_ACCESS_TOKEN, env.vertexAccessToken(), null, null);
    }
    String envKeyPath = firstPresent(env.vertexServiceAccount(), env.vertexJsonFile());
    if (envKeyPath != null) {
      return new AuthMethodDefaults("environment", null, envKeyPath, null);
    }
    return new AuthMethodDefaults(
        "settings",
        vertex.getAccessToken(),
        vertex.getServiceAccountKeyPath(),
        vertex.getServiceAccountData());
  }

  private record AuthMethodDefaults(
      String source, String accessToken, String keyPath, Map<String, Object> keyData) {}

  private AuthSettings.VertexSettings vertexSettings() {
    AuthSettings.VertexSettings vertex = settings.getVertex();
    return vertex == null ? new AuthSettings.VertexSettings() : vertex;
  }

  private static String apiKeySource(AuthOptions opts, AuthEnvironment env) {
    if (opts.getApiKey() != null) {
      return "request options";
    }
    return env.geminiApiKey() != null ? AuthEnvironment.GEMINI_API_KEY : "settings";
  }
}
