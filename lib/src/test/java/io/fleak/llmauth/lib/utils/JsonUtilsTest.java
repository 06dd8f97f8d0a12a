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
package io.fleak.llmauth.lib.utils;

import static io.fleak.llmauth.lib.TestUtils.fromJson;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fleak.llmauth.api.credentials.AccessTokenCredentials;
import io.fleak.llmauth.api.credentials.ApiKeyCredentials;
import io.fleak.llmauth.api.credentials.Credentials;
import io.fleak.llmauth.api.credentials.ServiceAccountDataCredentials;
import io.fleak.llmauth.api.jwt.JwtPayload;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonUtilsTest {

  @Test
  void parseJsonObject() throws JsonProcessingException {
    assertEquals(Map.of("a", 1), JsonUtils.parseJsonObject("{\"a\":1}"));
    assertThrows(JsonProcessingException.class, () -> JsonUtils.parseJsonObject("null"));
    assertThrows(JsonProcessingException.class, () -> JsonUtils.parseJsonObject("{} trailing"));
    assertThrows(JsonProcessingException.class, () -> JsonUtils.parseJsonObject("[1]"));
  }

  @Test
  void credentialsAreTaggedByType() {
    String json = JsonUtils.toJsonString(new AccessTokenCredentials("tok", "p", "us-central1"));
    Map<?, ?> tree = fromJson(json, Map.class);
    assertEquals("access_token", tree.get("type"));

    Credentials parsed =
        fromJson(
            "{\"type\":\"service_account_data\",\"data\":{\"client_email\":\"a@b\"},"
                + "\"projectId\":\"p\",\"location\":\"l\"}",
            Credentials.class);
    assertInstanceOf(ServiceAccountDataCredentials.class, parsed);
    assertEquals("a@b", ((ServiceAccountDataCredentials) parsed).data().get("client_email"));
  }

  @Test
  void credentialsToStringMasksSecrets() {
    assertFalse(new ApiKeyCredentials("sk-live-123").toString().contains("sk-live"));
    assertFalse(new AccessTokenCredentials("ya29.x", "p", "l").toString().contains("ya29"));
  }

  @Test
  void jwtPayloadUsesRegisteredClaimNames() {
    String json = JsonUtils.toJsonString(new JwtPayload("iss@x", "aud", "aud", 10, 20));

    assertEquals(
        Map.of("iss", "iss@x", "aud", "aud", "sub", "aud", "iat", 10, "exp", 20),
        fromJson(json, Map.class));
  }
}
