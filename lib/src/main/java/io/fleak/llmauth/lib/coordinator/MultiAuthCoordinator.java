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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.fleak.llmauth.api.AuthHeader;
import io.fleak.llmauth.api.AuthStrategy;
import io.fleak.llmauth.api.AuthStrategyKind;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.errors.AuthException;
import io.fleak.llmauth.api.errors.CoordinationException;
import io.fleak.llmauth.api.errors.UnknownStrategyException;
import io.fleak.llmauth.lib.config.AuthOptions;
import io.fleak.llmauth.lib.config.AuthSettings;
import io.fleak.llmauth.lib.http.SimpleHttpClient;
import io.fleak.llmauth.lib.jwt.JwtManager;
import io.fleak.llmauth.lib.jwt.Rs256JwtSigner;
import io.fleak.llmauth.lib.oauth.OAuthTokenExchanger;
import io.fleak.llmauth.lib.resolver.CredentialResolver;
import io.fleak.llmauth.lib.strategy.ApiKeyStrategy;
import io.fleak.llmauth.lib.strategy.ServiceAccountStrategy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for authenticating requests against either surface of the provider.
 *
 * <pre>
 * MultiAuthCoordinator coordinator = MultiAuthCoordinator.create(AuthSettings.defaults());
 * AuthenticatedRoute route =
 *     coordinator.prepareRoute(AuthStrategyKind.SERVICE_ACCOUNT, "gemini-1.5-pro",
 *         "generateContent", AuthOptions.builder().projectId("my-project").build());
 * // hand route.url() and route.headerEntries() to the HTTP transport
 * </pre>
 *
 * <p>Every call resolves credentials again; the coordinator holds no per-request state and can be
 * shared across threads.
 */
@Slf4j
public class MultiAuthCoordinator {

  private final CredentialResolver resolver;
  private final Map<AuthStrategyKind, AuthStrategy> strategies;

  public MultiAuthCoordinator(
      @NonNull CredentialResolver resolver, @NonNull List<AuthStrategy> strategies) {
    this.resolver = resolver;
    this.strategies = new EnumMap<>(AuthStrategyKind.class);
    for (AuthStrategy strategy : strategies) {
      this.strategies.put(strategy.kind(), strategy);
    }
  }

  public static MultiAuthCoordinator create(@NonNull AuthSettings settings) {
    return create(
        settings,
        System::getenv,
        SimpleHttpClient.create(Duration.ofMillis(settings.getHttpTimeoutMillis())));
  }

  @VisibleForTesting
  public static MultiAuthCoordinator create(
      @NonNull AuthSettings settings,
      @NonNull UnaryOperator<String> getenv,
      @NonNull SimpleHttpClient httpClient) {
    JwtManager jwtManager = new JwtManager(new Rs256JwtSigner(), httpClient, settings);
    OAuthTokenExchanger tokenExchanger =
        new OAuthTokenExchanger(jwtManager, httpClient, settings.getOauthTokenUrl());
    return new MultiAuthCoordinator(
        new CredentialResolver(settings, getenv),
        List.of(
            new ApiKeyStrategy(settings.getGeminiBaseUrl()),
            new ServiceAccountStrategy(jwtManager, tokenExchanger)));
  }

  /**
   * Resolves credentials for {@code kind}, authenticates them and builds the request headers.
   *
   * @throws CoordinationException wrapping any failure, prefixed with the strategy name
   */
  public AuthResult coordinateAuth(@NonNull AuthStrategyKind kind, AuthOptions options) {
    AuthStrategy strategy = strategy(kind);
    try {
      Credentials credentials = resolver.resolve(kind, options);
      strategy.authenticate(credentials);
      List<AuthHeader> headers = strategy.headers(credentials);
      log.debug("authenticated with {} using {}", kind.getDisplayName(), credentials.type());
      return new AuthResult(kind, headers, credentials);
    } catch (AuthException e) {
      throw new CoordinationException(kind, e);
    }
  }

  /**
   * Same as {@link #coordinateAuth(AuthStrategyKind, AuthOptions)} with the strategy given by name
   * ({@code gemini}, {@code vertex_ai}, ...).
   *
   * @throws UnknownStrategyException if the name matches no strategy
   */
  public AuthResult coordinateAuth(String strategyName, AuthOptions options) {
    return coordinateAuth(AuthStrategyKind.fromValue(strategyName), options);
  }

  /** Authenticates already-built credentials with the strategy their shape selects. */
  public AuthResult coordinateAuth(@NonNull Credentials credentials) {
    AuthStrategyKind kind = credentials.type().getStrategyKind();
    AuthStrategy strategy = strategy(kind);
    try {
      strategy.authenticate(credentials);
      return new AuthResult(kind, strategy.headers(credentials), credentials);
    } catch (AuthException e) {
      throw new CoordinationException(kind, e);
    }
  }

  /**
   * Guesses the strategy from the keys of a loose credential map: an API key means {@link
   * AuthStrategyKind#API_KEY}, a project id means {@link AuthStrategyKind#SERVICE_ACCOUNT}. This
   * is a heuristic; prefer passing the kind explicitly.
   */
  public static AuthStrategyKind determineStrategy(Map<String, ?> credentials) {
    if (credentials != null) {
      if (credentials.containsKey("api_key") || credentials.containsKey("apiKey")) {
        return AuthStrategyKind.API_KEY;
      }
      if (credentials.containsKey("project_id") || credentials.containsKey("projectId")) {
        return AuthStrategyKind.SERVICE_ACCOUNT;
      }
    }
    throw new UnknownStrategyException("Cannot determine auth strategy from credentials");
  }

  public String getBaseUrl(@NonNull AuthStrategyKind kind, Credentials credentials) {
    return strategy(kind).baseUrl(credentials);
  }

  public String buildPath(
      @NonNull AuthStrategyKind kind, String model, String endpoint, Credentials credentials) {
    return strategy(kind).buildPath(model, endpoint, credentials);
  }

  public Credentials refreshCredentials(@NonNull AuthStrategyKind kind, Credentials credentials) {
    return strategy(kind).refreshCredentials(credentials);
  }

  /** Resolves credentials from the environment and settings alone, then refreshes them. */
  public Credentials refreshCredentials(@NonNull AuthStrategyKind kind) {
    return refreshCredentials(kind, resolver.resolve(kind, AuthOptions.NONE));
  }

  /**
   * Authenticates and assembles headers, base URL and path for invoking {@code endpoint} on
   * {@code model}.
   */
  public AuthenticatedRoute prepareRoute(
      @NonNull AuthStrategyKind kind, String model, String endpoint, AuthOptions options) {
    Preconditions.checkNotNull(model, "model is required");
    Preconditions.checkNotNull(endpoint, "endpoint is required");
    AuthResult auth = coordinateAuth(kind, options);
    AuthStrategy strategy = strategy(kind);
    try {
      return new AuthenticatedRoute(
          kind,
          auth.headers(),
          strategy.baseUrl(auth.credentials()),
          strategy.buildPath(model, endpoint, auth.credentials()));
    } catch (AuthException e) {
      throw new CoordinationException(kind, e);
    }
  }

  /** Authenticates and assembles headers, base URL and path for listing models. */
  public AuthenticatedRoute modelsRoute(@NonNull AuthStrategyKind kind, AuthOptions options) {
    AuthResult auth = coordinateAuth(kind, options);
    AuthStrategy strategy = strategy(kind);
    try {
      return new AuthenticatedRoute(
          kind,
          auth.headers(),
          strategy.baseUrl(auth.credentials()),
          strategy.modelsPath(auth.credentials()));
    } catch (AuthException e) {
      throw new CoordinationException(kind, e);
    }
  }

  private AuthStrategy strategy(AuthStrategyKind kind) {
    AuthStrategy strategy = strategies.get(kind);
    if (strategy == null) {
      throw new UnknownStrategyException("Unknown authentication strategy: " + kind);
    }
    return strategy;
  }
}
