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
package io.fleak.llmauth.lib.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.llmauth.lib.utils.YamlUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Application-level static configuration: the lowest-precedence credential source plus the
 * endpoints and limits used for token generation.
 *
 * <pre>
 * geminiApiKey: "..."
 * vertex:
 *   projectId: my-project
 *   location: europe-west4
 *   serviceAccountKeyPath: /etc/keys/vertex.json
 * tokenLifetimeSeconds: 3600
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthSettings {
  public static final String DEFAULT_LOCATION = "us-central1";
  public static final String DEFAULT_GEMINI_BASE_URL =
      "https://generativelanguage.googleapis.com/v1beta";
  public static final String DEFAULT_IAM_CREDENTIALS_URL =
      "https://iamcredentials.googleapis.com/v1";
  public static final String DEFAULT_OAUTH_TOKEN_URL = "https://oauth2.googleapis.com/token";
  public static final long DEFAULT_TOKEN_LIFETIME_SECONDS = 3600;
  public static final long DEFAULT_HTTP_TIMEOUT_MILLIS = 60_000;

  @ToString.Exclude private String geminiApiKey;
  private @Builder.Default VertexSettings vertex = new VertexSettings();

  private @Builder.Default String geminiBaseUrl = DEFAULT_GEMINI_BASE_URL;
  private @Builder.Default String iamCredentialsUrl = DEFAULT_IAM_CREDENTIALS_URL;
  private @Builder.Default String oauthTokenUrl = DEFAULT_OAUTH_TOKEN_URL;
  private @Builder.Default long tokenLifetimeSeconds = DEFAULT_TOKEN_LIFETIME_SECONDS;
  private @Builder.Default long httpTimeoutMillis = DEFAULT_HTTP_TIMEOUT_MILLIS;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class VertexSettings {
    private String projectId;
    private String location;
    @ToString.Exclude private String accessToken;
    private String serviceAccountKeyPath;
    @ToString.Exclude private Map<String, Object> serviceAccountData;
  }

  public static AuthSettings defaults() {
    return AuthSettings.builder().build();
  }

  public static AuthSettings fromYamlFile(Path path) throws IOException {
    return normalize(YamlUtils.fromYamlFile(path, AuthSettings.class));
  }

  public static AuthSettings fromYamlResource(String resourcePath) throws IOException {
    return normalize(YamlUtils.fromYamlResource(resourcePath, AuthSettings.class));
  }

  public static AuthSettings fromYamlString(String yaml) {
    return normalize(YamlUtils.fromYamlString(yaml, new TypeReference<AuthSettings>() {}));
  }

  // a YAML document without a vertex section deserializes to null
  private static AuthSettings normalize(AuthSettings settings) {
    if (settings == null) {
      return defaults();
    }
    if (settings.getVertex() == null) {
      settings.setVertex(new VertexSettings());
    }
    return settings;
  }
}
