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

import io.fleak.llmauth.api.credentials.Credentials;
import java.util.List;

/**
 * Authentication algorithm for one surface of the provider. Implementations are stateless and may
 * be shared across threads.
 */
public interface AuthStrategy {

  AuthStrategyKind kind();

  /**
   * Validates the credentials.
   *
   * @throws io.fleak.llmauth.api.errors.AuthException if the credentials are unusable
   */
  AuthenticationResult authenticate(Credentials credentials);

  /**
   * Builds the headers for an outbound request. Never throws for credentials of the strategy's own
   * family; failures must already have been reported by {@link #authenticate}.
   */
  List<AuthHeader> headers(Credentials credentials);

  String baseUrl(Credentials credentials);

  /** Resource path for invoking {@code endpoint} (e.g. {@code generateContent}) on a model. */
  String buildPath(String model, String endpoint, Credentials credentials);

  /** Resource path for listing models. */
  String modelsPath(Credentials credentials);

  /** Returns credentials holding a fresh token, or the same credentials if nothing expires. */
  Credentials refreshCredentials(Credentials credentials);
}
