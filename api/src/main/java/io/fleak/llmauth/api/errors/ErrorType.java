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
package io.fleak.llmauth.api.errors;

/** Classification of authentication failures. */
public enum ErrorType {
  /** Missing project id, location, API key or authentication method. */
  CONFIGURATION,
  /** Malformed JSON, missing service account fields, invalid JWT structure. */
  CREDENTIAL_FORMAT,
  /** Bad private key, or a signing/token endpoint rejected the request. */
  SIGNING,
  /** Network failure reaching a remote endpoint. */
  TRANSPORT,
  UNKNOWN_STRATEGY
}
