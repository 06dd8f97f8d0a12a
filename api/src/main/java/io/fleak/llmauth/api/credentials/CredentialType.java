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
package io.fleak.llmauth.api.credentials;

import io.fleak.llmauth.api.AuthStrategyKind;
import lombok.Getter;

/** Tag of the {@link Credentials} union. */
@Getter
public enum CredentialType {
  API_KEY(AuthStrategyKind.API_KEY),
  ACCESS_TOKEN(AuthStrategyKind.SERVICE_ACCOUNT),
  SERVICE_ACCOUNT_KEY_FILE(AuthStrategyKind.SERVICE_ACCOUNT),
  SERVICE_ACCOUNT_DATA(AuthStrategyKind.SERVICE_ACCOUNT),
  PRE_SIGNED_JWT(AuthStrategyKind.SERVICE_ACCOUNT);

  /** The only strategy eligible for credentials of this shape. */
  private final AuthStrategyKind strategyKind;

  CredentialType(AuthStrategyKind strategyKind) {
    this.strategyKind = strategyKind;
  }
}
