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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What a successful {@link AuthStrategy#authenticate} call established about the credentials. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticationResult {

  public enum AuthType {
    API_KEY,
    ACCESS_TOKEN,
    JWT_TOKEN,
    SERVICE_ACCOUNT
  }

  private AuthType authType;

  /** API key, access token or JWT; null for service account material. */
  private String token;

  private String clientEmail;
  private String projectId;
}
