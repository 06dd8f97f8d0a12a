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
package io.fleak.llmauth.api.jwt;

import io.fleak.llmauth.api.credentials.ServiceAccountKey;

/** Signs a JWT payload locally with the private key of a service account. */
@FunctionalInterface
public interface JwtSigner {

  /**
   * @return the compact serialized JWT
   * @throws io.fleak.llmauth.api.errors.SigningException if the key material is missing or
   *     malformed, or signing fails
   */
  String sign(JwtPayload payload, ServiceAccountKey key);
}
