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
package io.fleak.llmauth.lib.coordinator;

import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.AuthStrategyKind;
import java.util.List;

/** Everything an HTTP transport needs to send an authenticated request to one resource. */
public record AuthenticatedRoute(
    AuthStrategyKind strategyKind, List<AuthHeader> headers, String baseUrl, String path) {

  public AuthenticatedRoute {
    headers = List.copyOf(headers);
  }

  public String url() {
    return baseUrl + "/" + path;
  }

  public List<String> headerEntries() {
    return headers.stream().map(AuthHeader::toHeaderEntry).toList();
  }
}
