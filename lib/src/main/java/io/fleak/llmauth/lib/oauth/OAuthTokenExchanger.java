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
package io.fleak.llmauth.lib.oauth;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.credentials.ServiceAccountKey;
import io.fleak.llmauth.api.errors.CredentialFormatException;
import io.fleak.llmauth.api.errors.SigningException;
import io.fleak.llmauth.api.jwt.JwtPayload;
import io.fleak.llmauth.lib.http.HttpResult;
import io.fleak.llmauth.lib.http.SimpleHttpClient;
import io.fleak.llmauth.lib.jwt.JwtManager;
import io.fleak.llmauth.lib.utils.JsonUtils;
import java.net.URLEncoder;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Trades a self-signed service account assertion for an OAuth2 access token (RFC 7523 JWT bearer
 * grant).
 *
 * <p>The assertion carries {@code iss = client_email}, {@code aud = token_uri}, the cloud-platform
 * scope and no subject.
 */
@Slf4j
public class OAuthTokenExchanger {

  public static final String CLOUD_PLATFORM_SCOPE =
      "https://www.googleapis.com/auth/cloud-platform";
  public static final String JWT_BEARER_GRANT_TYPE =
      "urn:ietf:params:oauth:grant-type:jwt-bearer";

  private final JwtManager jwtManager;
  private final SimpleHttpClient httpClient;
  private final String defaultTokenUrl;

  public OAuthTokenExchanger(
      @NonNull JwtManager jwtManager,
      @NonNull SimpleHttpClient httpClient,
      @NonNull String defaultTokenUrl) {
    this.jwtManager = jwtManager;
    this.httpClient = httpClient;
    this.defaultTokenUrl = defaultTokenUrl;
  }

  public String fetchAccessToken(@NonNull ServiceAccountKey key) {
    if (StringUtils.isBlank(key.getClientEmail())) {
      throw new CredentialFormatException(
          "Service account data missing required field: client_email");
    }
    String tokenUrl = StringUtils.defaultIfBlank(key.getTokenUri(), defaultTokenUrl);
    String assertion = jwtManager.signWithKey(buildAssertion(key.getClientEmail(), tokenUrl), key);

    String body =
        "grant_type="
            + URLEncoder.encode(JWT_BEARER_GRANT_TYPE, UTF_8)
            + "&assertion="
            + URLEncoder.encode(assertion, UTF_8);
    HttpResult result =
        httpClient.post(
            tokenUrl,
            body,
            List.of(AuthHeader.CONTENT_TYPE + ": application/x-www-form-urlencoded"));
    if (!result.isOk()) {
      throw new SigningException(
          "Token exchange failed: HTTP " + result.statusCode() + ": " + result.body(),
          result.statusCode());
    }

    Map<String, Object> response;
    try {
      response = JsonUtils.parseJsonObject(result.body());
    } catch (JsonProcessingException e) {
      throw new SigningException(
          "Token exchange failed: unparsable response: " + e.getOriginalMessage(), e);
    }
    if (!(response.get("access_token") instanceof String accessToken)
        || accessToken.isEmpty()) {
      throw new SigningException("Token exchange failed: no access_token in response");
    }
    log.info("obtained access token for service account {}", key.getClientEmail());
    return accessToken;
  }

  JwtPayload buildAssertion(String clientEmail, String tokenUrl) {
    long issuedAt = jwtManager.now();
    return new JwtPayload(
        clientEmail,
        tokenUrl,
        null,
        issuedAt,
        issuedAt + jwtManager.getDefaultLifetimeSeconds(),
        CLOUD_PLATFORM_SCOPE);
  }
}
