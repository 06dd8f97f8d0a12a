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

import java.util.OptionalInt;

/**
 * Raised when a JWT cannot be signed locally or a remote signing/token endpoint answers with an
 * error. Remote failures carry the HTTP status code.
 */
public class SigningException extends AuthException {

  private final Integer statusCode;

  public SigningException(String message) {
    this(message, null, null);
  }

  public SigningException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public SigningException(String message, int statusCode) {
    this(message, Integer.valueOf(statusCode), null);
  }

  private SigningException(String message, Integer statusCode, Throwable cause) {
    super(ErrorType.SIGNING, message, cause);
    this.statusCode = statusCode;
  }

  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
