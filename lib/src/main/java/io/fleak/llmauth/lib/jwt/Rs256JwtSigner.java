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

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.fleak.llmauth.api.credentials.ServiceAccountKey;
import io.fleak.llmauth.api.errors.SigningException;
import io.fleak.llmauth.api.jwt.JwtPayload;
import io.fleak.llmauth.api.jwt.JwtSigner;
import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Instant;
import java.util.Date;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;

/** Signs JWTs with RS256 using the PEM encoded private key of a service account. */
public class Rs256JwtSigner implements JwtSigner {

  static final String INVALID_KEY_FORMAT = "Invalid service account key format";

  @Override
  public String sign(JwtPayload payload, ServiceAccountKey key) {
    if (key == null || StringUtils.isBlank(key.getPrivateKey())) {
      throw new SigningException(INVALID_KEY_FORMAT);
    }
    PrivateKey privateKey = fromPemEncodedPrivateKey(key.getPrivateKey());

    JWSHeader.Builder header = new JWSHeader.Builder(JWSAlgorithm.RS256).type(JOSEObjectType.JWT);
    if (StringUtils.isNotBlank(key.getPrivateKeyId())) {
      header.keyID(key.getPrivateKeyId());
    }
    SignedJWT jwt = new SignedJWT(header.build(), toClaims(payload));
    try {
      jwt.sign(new RSASSASigner(privateKey));
    } catch (JOSEException | IllegalArgumentException e) {
      // IllegalArgumentException: not an RSA key, or shorter than 2048 bits
      throw new SigningException(INVALID_KEY_FORMAT + ": " + e.getMessage(), e);
    }
    return jwt.serialize();
  }

  static JWTClaimsSet toClaims(JwtPayload payload) {
    JWTClaimsSet.Builder claims =
        new JWTClaimsSet.Builder()
            .issuer(payload.issuer())
            .audience(payload.audience())
            .subject(payload.subject())
            .issueTime(Date.from(Instant.ofEpochSecond(payload.issuedAt())))
            .expirationTime(Date.from(Instant.ofEpochSecond(payload.expiry())));
    if (payload.scope() != null) {
      claims.claim("scope", payload.scope());
    }
    return claims.build();
  }

  /** Reads a PKCS#8 ({@code BEGIN PRIVATE KEY}) or PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) key. */
  static PrivateKey fromPemEncodedPrivateKey(String pem) {
    // key material copied out of env vars often keeps the JSON escaped newlines
    String normalized = pem.replace("\\n", "\n");
    try (PEMParser parser = new PEMParser(new StringReader(normalized))) {
      Object pemObject;
      while ((pemObject = parser.readObject()) != null) {
        PrivateKeyInfo keyInfo = null;
        if (pemObject instanceof PrivateKeyInfo privateKeyInfo) {
          keyInfo = privateKeyInfo;
        } else if (pemObject instanceof PEMKeyPair pemKeyPair) {
          keyInfo = pemKeyPair.getPrivateKeyInfo();
        }
        if (keyInfo != null) {
          return KeyFactory.getInstance("RSA")
              .generatePrivate(new PKCS8EncodedKeySpec(keyInfo.getEncoded()));
        }
      }
    } catch (IOException | GeneralSecurityException | RuntimeException e) {
      // bouncycastle reports corrupt base64 and ASN.1 with unchecked DecoderException and friends
      throw new SigningException(INVALID_KEY_FORMAT + ": " + e.getMessage(), e);
    }
    throw new SigningException(INVALID_KEY_FORMAT + ": no private key found in PEM data");
  }
}
