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
package io.fleak.llmauth.lib.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.net.UrlEscapers;
import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.credentials.ServiceAccountKey;
import io.fleak.llmauth.api.errors.ConfigurationException;
import io.fleak.llmauth.api.errors.CredentialFormatException;
import io.fleak.llmauth.api.errors.SigningException;
import io.fleak.llmauth.api.jwt.JwtPayload;
import io.fleak.llmauth.api.jwt.JwtSigner;
import io.fleak.llmauth.lib.config.AuthSettings;
import io.fleak.llmauth.lib.http.HttpResult;
import io.fleak.llmauth.lib.http.SimpleHttpClient;
import io.fleak.llmauth.lib.utils.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds JWT claim sets for service accounts and signs them, either locally through a {@link
 * JwtSigner} or remotely through the IAM credentials {@code signJwt} API.
 *
 * <p>Payloads are built per call from the clock; nothing is cached.
 */
@Slf4j
public class JwtManager {

  private final JwtSigner signer;
  private final SimpleHttpClient httpClient;
  private final String iamCredentialsUrl;
  private final long defaultLifetimeSeconds;
  private final Clock clock;

  public JwtManager(JwtSigner signer, SimpleHttpClient httpClient, AuthSettings settings) {
    this(
        signer,
        httpClient,
        settings.getIamCredentialsUrl(),
        settings.getTokenLifetimeSeconds(),
        Clock.systemUTC());
  }

  @VisibleForTesting
  public JwtManager(
      @NonNull JwtSigner signer,
      @NonNull SimpleHttpClient httpClient,
      @NonNull String iamCredentialsUrl,
      long defaultLifetimeSeconds,
      @NonNull Clock clock) {
    Preconditions.checkArgument(defaultLifetimeSeconds > 0, "token lifetime must be positive");
    this.signer = signer;
    this.httpClient = httpClient;
    this.iamCredentialsUrl = StringUtils.removeEnd(iamCredentialsUrl, "/");
    this.defaultLifetimeSeconds = defaultLifetimeSeconds;
    this.clock = clock;
  }

  public JwtPayload createPayload(String issuer, String audience) {
    return createPayload(issuer, audience, defaultLifetimeSeconds, now());
  }

  /**
   * The subject is set to the audience, not the issuer. Deployments validating these tokens
   * expect {@code sub == aud}.
   */
  public JwtPayload createPayload(
      String issuer, String audience, long lifetimeSeconds, long issuedAt) {
    return new JwtPayload(issuer, audience, audience, issuedAt, issuedAt + lifetimeSeconds);
  }

  public void validatePayload(JwtPayload payload) {
    if (payload == null
        || StringUtils.isAnyEmpty(payload.issuer(), payload.audience(), payload.subject())
        || payload.expiry() <= payload.issuedAt()) {
      throw new CredentialFormatException("Invalid JWT payload format");
    }
  }

  public String signWithKey(JwtPayload payload, ServiceAccountKey key) {
    if (key == null || StringUtils.isBlank(key.getPrivateKey())) {
      throw new SigningException("Invalid service account key format");
    }
    return signer.sign(payload, key);
  }

  /**
   * Signs the payload with the IAM credentials API on behalf of {@code serviceAccountEmail}.
   *
   * @throws SigningException carrying the status code if the API answers with anything but 200,
   *     or if the response has no {@code signedJwt}
   * @throws io.fleak.llmauth.api.errors.TransportException if the API cannot be reached
   */
  public String signWithIamApi(JwtPayload payload, String serviceAccountEmail, String accessToken) {
    String url =
        iamCredentialsUrl
            + "/projects/-/serviceAccounts/"
            + UrlEscapers.urlPathSegmentEscaper().escape(Strings.nullToEmpty(serviceAccountEmail))
            + ":signJwt";
    String body = JsonUtils.toJsonString(Map.of("payload", JsonUtils.toJsonString(payload)));
    List<String> headers =
        List.of(
            AuthHeader.bearer(accessToken).toHeaderEntry(),
            AuthHeader.jsonContentType().toHeaderEntry());

    HttpResult result = httpClient.post(url, body, headers);
    if (!result.isOk()) {
      throw new SigningException(
          "HTTP " + result.statusCode() + ": " + result.body(), result.statusCode());
    }

    Map<String, Object> response;
    try {
      response = JsonUtils.parseJsonObject(result.body());
    } catch (JsonProcessingException e) {
      throw new SigningException("Failed to parse response: " + e.getOriginalMessage(), e);
    }
    if (!(response.get("signedJwt") instanceof String signedJwt)) {
      throw new SigningException("Unexpected response format: " + result.body());
    }
    log.info("signed JWT for {} through the IAM credentials API", serviceAccountEmail);
    return signedJwt;
  }

  public ServiceAccountKey loadServiceAccountKey(String keyPath) {
    return toServiceAccountKey(readServiceAccountJson(keyPath));
  }

  /**
   * Reads a key file into its raw JSON map.
   *
   * @throws ConfigurationException if the file cannot be read
   * @throws CredentialFormatException if the content is not a JSON object
   */
  public Map<String, Object> readServiceAccountJson(String keyPath) {
    if (keyPath == null) {
      throw new ConfigurationException("Could not read service account key file: null");
    }
    String content;
    try {
      content = Files.readString(Path.of(keyPath));
    } catch (IOException | InvalidPathException e) {
      throw new ConfigurationException("Could not read service account key file: " + keyPath, e);
    }
    try {
      return JsonUtils.parseJsonObject(content);
    } catch (JsonProcessingException e) {
      throw new CredentialFormatException(
          "Invalid JSON in service account key file: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Builds, validates and signs a payload. The backend is chosen by the first present option, in
   * this fixed order: key file path, inline key data, access token (IAM API).
   */
  public String createSignedToken(
      String serviceAccountEmail, String audience, @NonNull SignedTokenOptions options) {
    long lifetime =
        options.getLifetimeSeconds() != null
            ? options.getLifetimeSeconds()
            : defaultLifetimeSeconds;
    long issuedAt = options.getIssuedAt() != null ? options.getIssuedAt() : now();
    JwtPayload payload = createPayload(serviceAccountEmail, audience, lifetime, issuedAt);
    validatePayload(payload);

    if (options.getServiceAccountKeyPath() != null) {
      log.debug("signing JWT for {} with key file", serviceAccountEmail);
      return signWithKey(payload, loadServiceAccountKey(options.getServiceAccountKeyPath()));
    }
    if (options.getServiceAccountData() != null) {
      log.debug("signing JWT for {} with inline key data", serviceAccountEmail);
      return signWithKey(payload, toServiceAccountKey(options.getServiceAccountData()));
    }
    if (options.getAccessToken() != null) {
      log.debug("signing JWT for {} through the IAM credentials API", serviceAccountEmail);
      return signWithIamApi(payload, serviceAccountEmail, options.getAccessToken());
    }
    throw new ConfigurationException(
        "Either service_account_key, service_account_data, or access_token must be provided");
  }

  public String getServiceAccountEmail(@NonNull ServiceAccountKey key) {
    return key.getClientEmail();
  }

  public static ServiceAccountKey toServiceAccountKey(Map<String, Object> data) {
    try {
      return JsonUtils.convertValue(data, ServiceAccountKey.class);
    } catch (IllegalArgumentException e) {
      throw new CredentialFormatException(
          "Invalid service account data: " + e.getMessage(), e);
    }
  }

  /** Current time in epoch seconds. */
  public long now() {
    return clock.instant().getEpochSecond();
  }

  public long getDefaultLifetimeSeconds() {
    return defaultLifetimeSeconds;
  }
}
