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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A resolved credential bundle. Exactly one shape is active per bundle; strategies dispatch on
 * {@link #type()} rather than on which fields happen to be set.
 *
 * <p>Bundles are request scoped: they are produced per call and never cached.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ApiKeyCredentials.class, name = "api_key"),
  @JsonSubTypes.Type(value = AccessTokenCredentials.class, name = "access_token"),
  @JsonSubTypes.Type(
      value = ServiceAccountKeyFileCredentials.class,
      name = "service_account_key_file"),
  @JsonSubTypes.Type(value = ServiceAccountDataCredentials.class, name = "service_account_data"),
  @JsonSubTypes.Type(value = PreSignedJwtCredentials.class, name = "pre_signed_jwt"),
})
public interface Credentials {

  @JsonIgnore
  CredentialType type();
}
