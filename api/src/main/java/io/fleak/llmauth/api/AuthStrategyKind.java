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
package io.fleak.llmauth.api;

import io.fleak.llmauth.api.errors.UnknownStrategyException;
import java.util.List;
import java.util.Locale;
import lombok.Getter;

/** Selects which {@link AuthStrategy} handles a request. */
@Getter
public enum AuthStrategyKind {
  /** Gemini API, authenticated with an API key. */
  API_KEY("Gemini", List.of("gemini", "api_key", "apikey")),
  /** Vertex AI, authenticated with OAuth2 access tokens or service account material. */
  SERVICE_ACCOUNT("Vertex AI", List.of("vertex_ai", "vertex", "service_account", "serviceaccount"));

  private final String displayName;
  private final List<String> aliases;

  AuthStrategyKind(String displayName, List<String> aliases) {
    this.displayName = displayName;
    this.aliases = aliases;
  }

  /**
   * Parses a strategy name such as {@code gemini}, {@code vertex_ai} or the enum constant name.
   *
   * @throws UnknownStrategyException if the value names no strategy
   */
  public static AuthStrategyKind fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AuthStrategyKind kind : values()) {
        if (kind.name().toLowerCase(Locale.ROOT).equals(normalized)
            || kind.aliases.contains(normalized)) {
          return kind;
        }
      }
    }
    throw new UnknownStrategyException("Unknown authentication strategy: " + value);
  }
}
