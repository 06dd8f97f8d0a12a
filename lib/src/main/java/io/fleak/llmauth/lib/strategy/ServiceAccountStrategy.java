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
package io.fleak.llmauth.lib.strategy;

import com.google.common.base.Preconditions;
import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.AuthStrategy;
import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.AuthenticationResult;
import io.fleak.llmauth.api.credentials.AccessTokenCredentials;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.credentials.PreSignedJwtCredentials;
import io.fleak.llmauth.api.credentials.ServiceAccountDataCredentials;
import io.fleak.llmauth.api.credentials.ServiceAccountKey;
import io.fleak.llmauth.api.credentials.ServiceAccountKeyFileCredentials;
import io.fleak.llmauth.api.credentials.VertexCredentials;
import io.fleak.llmauth.api.errors.AuthException;
import io.fleak.llmauth.api.errors.ConfigurationException;
import io.fleak.llmauth.api.errors.CredentialFormatException;
import io.fleak.llmauth.lib.jwt.JwtManager;
import io.fleak.llmauth.lib.oauth.OAuthTokenExchanger;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Vertex AI: OAuth2 bearer tokens obtained from an access token, a pre-signed JWT, a service
 * account key file or inline service account data.
 *
 * <p>Key file and inline credentials are exchanged for a fresh access token whenever headers are
 * built or credentials are refreshed. There is no token cache.
 */
@Slf4j
public class ServiceAccountStrategy implements AuthStrategy {

  /** Bearer value used when token generation fails while building headers. */
  public static final String ERROR_TOKEN = "service-account-error-token";

  public static final List<String> REQUIRED_FIELDS =
      List.of("client_email", "private_key", "project_id");

  static final String GLOBAL_LOCATION = "global";

  private final JwtManager jwtManager;
  private final OAuthTokenExchanger tokenExchanger;

  public ServiceAccountStrategy(
      @NonNull JwtManager jwtManager, @NonNull OAuthTokenExchanger tokenExchanger) {
    this.jwtManager = jwtManager;
    this.tokenExchanger = tokenExchanger;
  }

  @Override
  public AuthStrategyKind kind() {
    return AuthStrategyKind.SERVICE_ACCOUNT;
  }

  @Override
  public AuthenticationResult authenticate(Credentials credentials) {
    VertexCredentials vertex = vertex(credentials);
    return switch (vertex.type()) {
      case ACCESS_TOKEN -> {
        String token = ((AccessTokenCredentials) vertex).token();
        if (StringUtils.isEmpty(token)) {
          throw new CredentialFormatException("Invalid access token");
        }
        yield AuthenticationResult.builder()
            .authType(AuthenticationResult.AuthType.ACCESS_TOKEN)
            .token(token)
            .projectId(vertex.projectId())
            .build();
      }
      case PRE_SIGNED_JWT -> {
        String token = ((PreSignedJwtCredentials) vertex).token();
        if (token == null || !token.contains(".")) {
          throw new CredentialFormatException("Invalid JWT token format");
        }
        yield AuthenticationResult.builder()
            .authType(AuthenticationResult.AuthType.JWT_TOKEN)
            .token(token)
            .projectId(vertex.projectId())
            .build();
      }
      case SERVICE_ACCOUNT_KEY_FILE -> validateServiceAccountData(
          jwtManager.readServiceAccountJson(((ServiceAccountKeyFileCredentials) vertex).keyPath()));
      case SERVICE_ACCOUNT_DATA -> validateServiceAccountData(
          ((ServiceAccountDataCredentials) vertex).data());
      case API_KEY -> throw wrongFamily(credentials);
    };
  }

  /**
   * Checks that {@code client_email}, {@code private_key} and {@code project_id} are present and
   * non-blank, reporting the first one missing.
   */
  public static AuthenticationResult validateServiceAccountData(Map<String, ?> data) {
    for (String field : REQUIRED_FIELDS) {
      Object value = data == null ? null : data.get(field);
      if (!(value instanceof String str) || StringUtils.isBlank(str)) {
        throw new CredentialFormatException(
            "Service account data missing required field: " + field);
      }
    }
    return AuthenticationResult.builder()
        .authType(AuthenticationResult.AuthType.SERVICE_ACCOUNT)
        .clientEmail((String) data.get("client_email"))
        .projectId((String) data.get("project_id"))
        .build();
  }

  @Override
  public List<AuthHeader> headers(Credentials credentials) {
    VertexCredentials vertex = vertex(credentials);
    String token =
        switch (vertex.type()) {
          case ACCESS_TOKEN -> ((AccessTokenCredentials) vertex).token();
          case PRE_SIGNED_JWT -> ((PreSignedJwtCredentials) vertex).token();
          case SERVICE_ACCOUNT_KEY_FILE, SERVICE_ACCOUNT_DATA -> accessTokenOrErrorToken(vertex);
          case API_KEY -> throw wrongFamily(credentials);
        };
    return List.of(AuthHeader.jsonContentType(), AuthHeader.bearer(token));
  }

  // header construction never fails; authenticate() has already reported unusable material
  private String accessTokenOrErrorToken(VertexCredentials vertex) {
    try {
      return generateAccessToken(vertex);
    } catch (AuthException e) {
      log.warn(
          "failed to generate Vertex AI access token, sending placeholder bearer token: {}",
          e.getMessage());
      return ERROR_TOKEN;
    }
  }

  /** Exchanges key file or inline service account material for an OAuth2 access token. */
  public String generateAccessToken(Credentials credentials) {
    ServiceAccountKey key;
    if (credentials instanceof ServiceAccountKeyFileCredentials keyFile) {
      key = jwtManager.loadServiceAccountKey(keyFile.keyPath());
    } else if (credentials instanceof ServiceAccountDataCredentials inline) {
      key = JwtManager.toServiceAccountKey(inline.data());
    } else {
      throw new CredentialFormatException("No service account credentials provided");
    }
    return tokenExchanger.fetchAccessToken(key);
  }

  @Override
  public String baseUrl(Credentials credentials) {
    VertexCredentials vertex = vertex(credentials);
    boolean hasProject = StringUtils.isNotBlank(vertex.projectId());
    boolean hasLocation = StringUtils.isNotBlank(vertex.location());
    if (!hasProject && !hasLocation) {
      throw new ConfigurationException(
          "Project ID and Location are required for Vertex AI base URL");
    }
    if (!hasLocation) {
      throw new ConfigurationException("Location is required for Vertex AI base URL");
    }
    if (!hasProject) {
      throw new ConfigurationException("Project ID is required for Vertex AI base URL");
    }
    if (GLOBAL_LOCATION.equals(vertex.location())) {
      return "https://aiplatform.googleapis.com/v1";
    }
    return "https://" + vertex.location() + "-aiplatform.googleapis.com/v1";
  }

  /**
   * {@code projects/{p}/locations/{l}/publishers/google/models/{model}:{endpoint}}, or {@code
   * models/{model}:{endpoint}} when project or location is unknown.
   */
  @Override
  public String buildPath(String model, String endpoint, Credentials credentials) {
    Preconditions.checkNotNull(model, "model is required");
    Preconditions.checkNotNull(endpoint, "endpoint is required");
    String modelPath = ModelPaths.normalizeModel(model) + ":" + endpoint;
    if (hasProjectAndLocation(credentials)) {
      VertexCredentials vertex = (VertexCredentials) credentials;
      return ModelPaths.vertexPublisherPrefix(vertex.projectId(), vertex.location())
          + "/"
          + modelPath;
    }
    return modelPath;
  }

  @Override
  public String modelsPath(Credentials credentials) {
    if (hasProjectAndLocation(credentials)) {
      VertexCredentials vertex = (VertexCredentials) credentials;
      return ModelPaths.vertexPublisherPrefix(vertex.projectId(), vertex.location())
          + "/"
          + ModelPaths.MODELS;
    }
    return ModelPaths.MODELS;
  }

  @Override
  public Credentials refreshCredentials(Credentials credentials) {
    VertexCredentials vertex = vertex(credentials);
    return switch (vertex.type()) {
      case SERVICE_ACCOUNT_KEY_FILE, SERVICE_ACCOUNT_DATA -> {
        String accessToken = generateAccessToken(vertex);
        log.info("refreshed Vertex AI access token for project {}", vertex.projectId());
        yield new AccessTokenCredentials(accessToken, vertex.projectId(), vertex.location());
      }
      default -> vertex;
    };
  }

  private static boolean hasProjectAndLocation(Credentials credentials) {
    return credentials instanceof VertexCredentials vertex
        && StringUtils.isNotBlank(vertex.projectId())
        && StringUtils.isNotBlank(vertex.location());
  }

  private static VertexCredentials vertex(Credentials credentials) {
    if (credentials instanceof VertexCredentials vertex) {
      return vertex;
    }
    throw wrongFamily(credentials);
  }

  private static CredentialFormatException wrongFamily(Credentials credentials) {
    return new CredentialFormatException(
        "Vertex AI strategy cannot use "
            + (credentials == null ? "null credentials" : credentials.type() + " credentials"));
  }
}
