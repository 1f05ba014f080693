//
// Copyright 2026 The ODIN Verifier Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.odin.jwks;

import com.google.common.base.MoreObjects;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.odin.util.Base64Url;
import com.odin.util.Result;
import java.util.Objects;
import java.util.Optional;

/** A public key record of a key set, in the JWK format ODIN publishes. */
public final class Jwk {
  public static final String KTY_OKP = "OKP";
  public static final String CRV_ED25519 = "Ed25519";
  public static final String ALG_EDDSA = "EdDSA";
  public static final String USE_SIG = "sig";

  private final String kty;
  private final String crv;
  private final String x;
  private final String kid;
  private final String alg;
  private final String use;

  public Jwk(String kty, String crv, String x, String kid, String alg, String use) {
    this.kty = kty;
    this.crv = crv;
    this.x = x;
    this.kid = kid;
    this.alg = alg;
    this.use = use;
  }

  /** Creates a signing key record for a raw 32-byte Ed25519 public key. */
  public static Jwk ed25519(byte[] publicKey, String kid) {
    return new Jwk(KTY_OKP, CRV_ED25519, Base64Url.encode(publicKey), kid, ALG_EDDSA, USE_SIG);
  }

  /**
   * Reads a key record from JSON. Members of the wrong type are ignored, so the result may be a
   * record that {@link #isEd25519Candidate()} rejects.
   */
  public static Jwk fromJson(JsonObject json) {
    return new Jwk(
        stringMember(json, "kty"),
        stringMember(json, "crv"),
        stringMember(json, "x"),
        stringMember(json, "kid"),
        stringMember(json, "alg"),
        stringMember(json, "use"));
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    addIfPresent(json, "kty", kty);
    addIfPresent(json, "crv", crv);
    addIfPresent(json, "x", x);
    addIfPresent(json, "kid", kid);
    addIfPresent(json, "alg", alg);
    addIfPresent(json, "use", use);
    return json;
  }

  /** True for OKP / Ed25519 records that carry key material. */
  public boolean isEd25519Candidate() {
    return KTY_OKP.equals(kty) && CRV_ED25519.equals(crv) && x != null;
  }

  /** Decodes {@code x}, failing unless it is exactly 32 bytes. */
  public Result<byte[], String> decodePublicKey() {
    Result<byte[], String> decoded = Base64Url.tryDecode(x);
    if (decoded.isSuccess() && decoded.success().get().length != 32) {
      return Result.error(
          String.format("expected 32-byte key, got %d bytes", decoded.success().get().length));
    }
    return decoded;
  }

  public String getKty() {
    return kty;
  }

  public String getCrv() {
    return crv;
  }

  public String getX() {
    return x;
  }

  public Optional<String> getKid() {
    return Optional.ofNullable(kid);
  }

  public Optional<String> getAlg() {
    return Optional.ofNullable(alg);
  }

  public Optional<String> getUse() {
    return Optional.ofNullable(use);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Jwk)) {
      return false;
    }
    Jwk that = (Jwk) o;
    return Objects.equals(kty, that.kty) && Objects.equals(crv, that.crv)
        && Objects.equals(x, that.x) && Objects.equals(kid, that.kid)
        && Objects.equals(alg, that.alg) && Objects.equals(use, that.use);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kty, crv, x, kid, alg, use);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kty", kty)
        .add("crv", crv)
        .add("kid", kid)
        .add("x", x)
        .toString();
  }

  private static String stringMember(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      return null;
    }
    return element.getAsString();
  }

  private static void addIfPresent(JsonObject json, String name, String value) {
    if (value != null) {
      json.addProperty(name, value);
    }
  }
}
