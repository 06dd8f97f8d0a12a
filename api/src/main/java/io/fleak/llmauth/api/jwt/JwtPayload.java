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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Claim set of a self-signed service account JWT. Times are epoch seconds.
 *
 * <p>Built fresh for every signing call and never reused.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JwtPayload(
    @JsonProperty("iss") String issuer,
    @JsonProperty("aud") String audience,
    @JsonProperty("sub") String subject,
    @JsonProperty("iat") long issuedAt,
    @JsonProperty("exp") long expiry,
    @JsonProperty("scope") String scope) {

  public JwtPayload(String issuer, String audience, String subject, long issuedAt, long expiry) {
    this(issuer, audience, subject, issuedAt, expiry, null);
  }

  public JwtPayload withScope(String scope) {
    return new JwtPayload(issuer, audience, subject, issuedAt, expiry, scope);
  }

  public long lifetimeSeconds() {
    return expiry - issuedAt;
  }
}
