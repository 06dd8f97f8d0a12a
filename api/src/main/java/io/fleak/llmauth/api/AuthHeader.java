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

import lombok.NonNull;

/** One outbound HTTP header produced by an {@link AuthStrategy}. */
public record AuthHeader(@NonNull String name, @NonNull String value) {

  public static final String AUTHORIZATION = "Authorization";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String APPLICATION_JSON = "application/json";

  public static AuthHeader bearer(String token) {
    return new AuthHeader(AUTHORIZATION, "Bearer " + token);
  }

  public static AuthHeader jsonContentType() {
    return new AuthHeader(CONTENT_TYPE, APPLICATION_JSON);
  }

  /** Renders the header as a {@code "Name: value"} entry. */
  public String toHeaderEntry() {
    return name + ": " + value;
  }
}
