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

package com.odin.ope;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.odin.util.Base64Url;
import com.odin.util.Result;
import com.odin.util.StrictJson;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A self-describing Origin Proof Envelope: the signature, the public key that made it and the
 * timestamp that was signed along with the content.
 */
public final class StructuredProof {
  public static final int VERSION = 1;
  public static final String ALGORITHM = "Ed25519";

  private static final Gson GSON = new Gson();
  private static final BigInteger UNSIGNED_LONG_LIMIT = BigInteger.ONE.shiftLeft(64);
  // 2^64 has 20 digits.
  private static final int MAX_INTEGER_DIGITS = 20;

  private final long version;
  private final String algorithm;
  private final long timestampNs;
  private final String kid;
  private final String publicKey;
  private final String contentHash;
  private final String signature;
  private final String contentId;

  /**
   * @param timestampNs nanoseconds since the epoch, interpreted as unsigned
   * @param publicKey base64url public key
   * @param contentHash base64url BLAKE3 digest of the content, may be null
   * @param signature base64url signature
   * @param contentId content identifier bound into the signed message, may be null
   */
  public StructuredProof(long version, String algorithm, long timestampNs, String kid,
      String publicKey, String contentHash, String signature, String contentId) {
    this.version = version;
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    this.timestampNs = timestampNs;
    this.kid = Objects.requireNonNull(kid, "kid");
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
    this.contentHash = contentHash;
    this.signature = Objects.requireNonNull(signature, "signature");
    this.contentId = contentId;
  }

  /**
   * Parses the decoded bytes of an {@code ope} field. Succeeds only if the bytes are a UTF-8 JSON
   * object with the members of a structured proof, of the right types.
   */
  public static Result<StructuredProof, String> parse(byte[] bytes) {
    return decodeUtf8(bytes)
        .andThen(text -> StrictJson.parse(text).mapError(error -> "not JSON"))
        .andThen(StructuredProof::fromJson);
  }

  private static Result<StructuredProof, String> fromJson(JsonElement root) {
    if (!root.isJsonObject()) {
      return Result.error("not a JSON object");
    }
    JsonObject json = root.getAsJsonObject();

    Optional<BigInteger> version = integerMember(json, "v");
    if (version.isEmpty() || version.get().bitLength() >= Long.SIZE) {
      return Result.error("'v' must be an integer");
    }
    Optional<BigInteger> timestamp = integerMember(json, "ts_ns");
    if (timestamp.isEmpty() || timestamp.get().signum() < 0
        || timestamp.get().compareTo(UNSIGNED_LONG_LIMIT) >= 0) {
      return Result.error("'ts_ns' must be an unsigned 64-bit integer");
    }
    String algorithm = nonEmptyString(json, "alg");
    String kid = nonEmptyString(json, "kid");
    String publicKey = nonEmptyString(json, "pub_b64u");
    String signature = nonEmptyString(json, "sig_b64u");
    if (algorithm == null || kid == null || publicKey == null || signature == null) {
      return Result.error("'alg', 'kid', 'pub_b64u' and 'sig_b64u' must be non-empty strings");
    }
    Result<String, String> contentHash = optionalString(json, "content_hash_b3_256_b64u");
    Result<String, String> contentId = optionalString(json, "oml_cid");
    if (contentHash.isError() || contentId.isError()) {
      return Result.error("'content_hash_b3_256_b64u' and 'oml_cid' must be strings");
    }
    return Result.success(new StructuredProof(version.get().longValue(), algorithm,
        timestamp.get().longValue(), kid, publicKey, Strings.emptyToNull(contentHash.orElse("")),
        signature, Strings.emptyToNull(contentId.orElse(""))));
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("v", version);
    json.addProperty("alg", algorithm);
    json.add("ts_ns", new JsonPrimitive(new BigInteger(Long.toUnsignedString(timestampNs))));
    json.addProperty("kid", kid);
    json.addProperty("pub_b64u", publicKey);
    if (contentHash != null) {
      json.addProperty("content_hash_b3_256_b64u", contentHash);
    }
    json.addProperty("sig_b64u", signature);
    if (contentId != null) {
      json.addProperty("oml_cid", contentId);
    }
    return json;
  }

  /** Returns the base64url encoding of the JSON form, as carried in an envelope's {@code ope}. */
  public String encode() {
    return Base64Url.encode(GSON.toJson(toJson()).getBytes(StandardCharsets.UTF_8));
  }

  /** Reconstructs the message this proof claims to sign over {@code content}. */
  public byte[] message(byte[] content) {
    return OpeMessage.build(timestampNs, content, contentId);
  }

  public long getVersion() {
    return version;
  }

  public String getAlgorithm() {
    return algorithm;
  }

  /** Unsigned nanoseconds since the epoch. */
  public long getTimestampNs() {
    return timestampNs;
  }

  public String getKid() {
    return kid;
  }

  public String getPublicKey() {
    return publicKey;
  }

  public Optional<String> getContentHash() {
    return Optional.ofNullable(contentHash);
  }

  public String getSignature() {
    return signature;
  }

  public Optional<String> getContentId() {
    return Optional.ofNullable(contentId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("v", version)
        .add("alg", algorithm)
        .add("ts_ns", Long.toUnsignedString(timestampNs))
        .add("kid", kid)
        .add("oml_cid", contentId)
        .toString();
  }

  private static Result<String, String> decodeUtf8(byte[] bytes) {
    try {
      return Result.success(StandardCharsets.UTF_8.newDecoder()
                                .onMalformedInput(CodingErrorAction.REPORT)
                                .onUnmappableCharacter(CodingErrorAction.REPORT)
                                .decode(ByteBuffer.wrap(bytes))
                                .toString());
    } catch (CharacterCodingException e) {
      return Result.error("not UTF-8");
    }
  }

  /**
   * Reads an integral number member. Numbers with more than {@link #MAX_INTEGER_DIGITS} digits on
   * either side of the decimal point are rejected before conversion.
   */
  private static Optional<BigInteger> integerMember(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      return Optional.empty();
    }
    try {
      BigDecimal value = element.getAsBigDecimal();
      if (value.signum() == 0) {
        return Optional.of(BigInteger.ZERO);
      }
      if (value.scale() > MAX_INTEGER_DIGITS
          || (long) value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
        return Optional.empty();
      }
      return Optional.of(value.toBigIntegerExact());
    } catch (ArithmeticException | NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static String nonEmptyString(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()
        || element.getAsString().isEmpty()) {
      return null;
    }
    return element.getAsString();
  }

  private static Result<String, String> optionalString(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || element.isJsonNull()) {
      return Result.success("");
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      return Result.error(name);
    }
    return Result.success(element.getAsString());
  }
}
