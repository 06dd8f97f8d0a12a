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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inline service account key material, keyed the way the JSON key file is ({@code client_email},
 * {@code private_key}, {@code project_id}, ...).
 */
public record ServiceAccountDataCredentials(
    Map<String, Object> data, String projectId, String location) implements VertexCredentials {

  public ServiceAccountDataCredentials {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  @Override
  public CredentialType type() {
    return CredentialType.SERVICE_ACCOUNT_DATA;
  }

  @Override
  public String toString() {
    return "ServiceAccountDataCredentials[client_email="
        + data.get("client_email")
        + ", projectId="
        + projectId
        + ", location="
        + location
        + "]";
  }
}
