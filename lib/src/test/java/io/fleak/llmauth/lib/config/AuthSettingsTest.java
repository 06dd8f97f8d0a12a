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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuthSettingsTest {

  @TempDir Path tempDir;

  @Test
  void defaults() {
    AuthSettings settings = AuthSettings.defaults();

    assertNull(settings.getGeminiApiKey());
    assertNotNull(settings.getVertex());
    assertEquals("https://generativelanguage.googleapis.com/v1beta", settings.getGeminiBaseUrl());
    assertEquals("https://iamcredentials.googleapis.com/v1", settings.getIamCredentialsUrl());
    assertEquals("https://oauth2.googleapis.com/token", settings.getOauthTokenUrl());
    assertEquals(3600, settings.getTokenLifetimeSeconds());
    assertEquals(60_000, settings.getHttpTimeoutMillis());
  }

  @Test
  void fromYamlResource() throws IOException {
    AuthSettings settings = AuthSettings.fromYamlResource("/config/auth-settings.yaml");

    assertEquals("settings-gemini-key", settings.getGeminiApiKey());
    assertEquals("yaml-project", settings.getVertex().getProjectId());
    assertEquals("europe-west4", settings.getVertex().getLocation());
    assertEquals("/etc/keys/vertex.json", settings.getVertex().getServiceAccountKeyPath());
    assertEquals(1800, settings.getTokenLifetimeSeconds());
    assertEquals(15_000, settings.getHttpTimeoutMillis());
    assertEquals(AuthSettings.DEFAULT_OAUTH_TOKEN_URL, settings.getOauthTokenUrl());
  }

  @Test
  void fromYamlResource_missing() {
    assertThrows(IOException.class, () -> AuthSettings.fromYamlResource("/config/nope.yaml"));
  }

  @Test
  void fromYamlFile_withoutVertexSection() throws IOException {
    Path file = tempDir.resolve("settings.yaml");
    Files.writeString(file, "geminiApiKey: k\n");

    AuthSettings settings = AuthSettings.fromYamlFile(file);

    assertEquals("k", settings.getGeminiApiKey());
    assertNotNull(settings.getVertex());
    assertNull(settings.getVertex().getProjectId());
  }

  @Test
  void fromYamlString_inlineServiceAccountData() {
    AuthSettings settings =
        AuthSettings.fromYamlString(
            """
            vertex:
              projectId: p
              serviceAccountData:
                client_email: svc@p.iam.gserviceaccount.com
                private_key: pem
            """);

    assertEquals(
        "svc@p.iam.gserviceaccount.com",
        settings.getVertex().getServiceAccountData().get("client_email"));
  }

  @Test
  void toStringHidesSecrets() {
    AuthSettings settings = AuthSettings.defaults();
    settings.setGeminiApiKey("super-secret");
    settings.getVertex().setAccessToken("also-secret");

    assertFalse(settings.toString().contains("secret"));
  }
}
