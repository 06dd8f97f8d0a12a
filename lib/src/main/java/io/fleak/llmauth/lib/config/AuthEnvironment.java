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
package io.fleak.llmauth.lib.config;

import java.util.function.UnaryOperator;

/**
 * The environment variables consulted during credential resolution, captured once per resolve
 * call so a single resolution sees one consistent view.
 */
public record AuthEnvironment(
    String geminiApiKey,
    String vertexProjectId,
    String googleCloudProject,
    String vertexLocation,
    String googleCloudLocation,
    String vertexAccessToken,
    String vertexServiceAccount,
    String vertexJsonFile,
    String googleApplicationCredentials) {

  public static final String GEMINI_API_KEY = "GEMINI_API_KEY";
  public static final String VERTEX_PROJECT_ID = "VERTEX_PROJECT_ID";
  public static final String GOOGLE_CLOUD_PROJECT = "GOOGLE_CLOUD_PROJECT";
  public static final String VERTEX_LOCATION = "VERTEX_LOCATION";
  public static final String GOOGLE_CLOUD_LOCATION = "GOOGLE_CLOUD_LOCATION";
  public static final String VERTEX_ACCESS_TOKEN = "VERTEX_ACCESS_TOKEN";
  public static final String VERTEX_SERVICE_ACCOUNT = "VERTEX_SERVICE_ACCOUNT";
  public static final String VERTEX_JSON_FILE = "VERTEX_JSON_FILE";
  public static final String GOOGLE_APPLICATION_CREDENTIALS = "GOOGLE_APPLICATION_CREDENTIALS";

  public static AuthEnvironment capture(UnaryOperator<String> getenv) {
    return new AuthEnvironment(
        getenv.apply(GEMINI_API_KEY),
        getenv.apply(VERTEX_PROJECT_ID),
        getenv.apply(GOOGLE_CLOUD_PROJECT),
        getenv.apply(VERTEX_LOCATION),
        getenv.apply(GOOGLE_CLOUD_LOCATION),
        getenv.apply(VERTEX_ACCESS_TOKEN),
        getenv.apply(VERTEX_SERVICE_ACCOUNT),
        getenv.apply(VERTEX_JSON_FILE),
        getenv.apply(GOOGLE_APPLICATION_CREDENTIALS));
  }

  @Override
  public String toString() {
    return "AuthEnvironment[projectId="
        + (vertexProjectId != null ? vertexProjectId : googleCloudProject)
        + ", location="
        + (vertexLocation != null ? vertexLocation : googleCloudLocation)
        + "]";
  }
}
