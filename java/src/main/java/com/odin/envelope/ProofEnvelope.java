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

package com.odin.envelope;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import com.odin.cid.ContentAddresser;
import com.odin.jwks.KeySet;
import com.odin.ope.StructuredProof;
import com.odin.util.Base64Url;
import java.util.Optional;

/**
 * The proof attached to an ODIN response: the signed content bytes, the claimed content identifier
 * and either a structured proof or a raw detached signature, plus where to find the signing keys.
 */
public final class ProofEnvelope {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  // Fields are set by Gson and never modified afterwards, so they are not declared final.

  @SerializedName("oml_cid") private String contentId;

  @SerializedName("kid") private String kid;

  /** Base64url of either a structured proof or a raw 64-byte signature. */
  @SerializedName("ope") private String proof;

  @SerializedName("jwks_url") private String keySetUrl;

  @SerializedName("jwks_inline") private JsonElement inlineKeySet;

  /** Base64url of the exact content bytes that were signed. */
  @SerializedName("oml_c_b64") private String content;

  /** Schema or format tag; carried through, never verified. */
  @SerializedName("sft_id") private String sftId;

  private ProofEnvelope() {}

  /**
   * Reads an envelope from its wire JSON.
   *
   * @throws JsonParseException if {@code json} is not an object or a member has the wrong type
   */
  public static ProofEnvelope fromJson(JsonElement json) {
    if (json == null || !json.isJsonObject()) {
      throw new JsonParseException("proof envelope must be a JSON object");
    }
    ProofEnvelope envelope = GSON.fromJson(json, ProofEnvelope.class);
    if (envelope.inlineKeySet != null) {
      envelope.inlineKeySet = envelope.inlineKeySet.deepCopy();
    }
    return envelope;
  }

  /** Same as {@link #fromJson(JsonElement)}, parsing {@code json} first. */
  public static ProofEnvelope fromJson(String json) {
    return fromJson(JsonParser.parseString(json));
  }

  public JsonObject toJson() {
    return GSON.toJsonTree(this).getAsJsonObject();
  }

  /** Wraps {@code content} with a structured proof over it. */
  public static ProofEnvelope forStructuredProof(byte[] content, StructuredProof proof) {
    return newBuilder()
        .setContentId(proof.getContentId().orElse(ContentAddresser.computeContentId(content)))
        .setKid(proof.getKid())
        .setProof(proof.encode())
        .setContent(content)
        .build();
  }

  /** Wraps {@code content} with a raw detached signature made by the key named {@code kid}. */
  public static ProofEnvelope forRawSignature(byte[] content, String kid, byte[] signature) {
    return newBuilder()
        .setContentId(ContentAddresser.computeContentId(content))
        .setKid(kid)
        .setProof(Base64Url.encode(signature))
        .setContent(content)
        .build();
  }

  public Optional<String> getContentId() {
    return Optional.ofNullable(contentId);
  }

  public Optional<String> getKid() {
    return Optional.ofNullable(kid);
  }

  public Optional<String> getProof() {
    return Optional.ofNullable(proof);
  }

  public Optional<String> getKeySetUrl() {
    return Optional.ofNullable(Strings.emptyToNull(keySetUrl));
  }

  /** The inline key set, if present and shaped like {@code {"keys": [...]}}. */
  public Optional<KeySet> getInlineKeySet() {
    return KeySet.fromJson(inlineKeySet);
  }

  /** The base64url content bytes as carried on the wire; empty strings count as absent. */
  public Optional<String> getContent() {
    return Optional.ofNullable(Strings.emptyToNull(content));
  }

  public Optional<String> getSftId() {
    return Optional.ofNullable(sftId);
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.envelope.contentId = contentId;
    builder.envelope.kid = kid;
    builder.envelope.proof = proof;
    builder.envelope.keySetUrl = keySetUrl;
    builder.envelope.inlineKeySet = inlineKeySet == null ? null : inlineKeySet.deepCopy();
    builder.envelope.content = content;
    builder.envelope.sftId = sftId;
    return builder;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("oml_cid", contentId)
        .add("kid", kid)
        .add("jwks_url", keySetUrl)
        .add("sft_id", sftId)
        .toString();
  }

  /** Assembles envelopes, mainly on the producing side and in tests. */
  public static final class Builder {
    private ProofEnvelope envelope = new ProofEnvelope();

    private Builder() {}

    public Builder setContentId(String contentId) {
      envelope.contentId = contentId;
      return this;
    }

    public Builder setKid(String kid) {
      envelope.kid = kid;
      return this;
    }

    public Builder setProof(String proof) {
      envelope.proof = proof;
      return this;
    }

    public Builder setKeySetUrl(String keySetUrl) {
      envelope.keySetUrl = keySetUrl;
      return this;
    }

    public Builder setInlineKeySet(KeySet keySet) {
      envelope.inlineKeySet = keySet == null ? null : keySet.toJson();
      return this;
    }

    /** Sets the wire value of {@code oml_c_b64} verbatim. */
    public Builder setEncodedContent(String content) {
      envelope.content = content;
      return this;
    }

    public Builder setContent(byte[] content) {
      envelope.content = content == null ? null : Base64Url.encode(content);
      return this;
    }

    public Builder setSftId(String sftId) {
      envelope.sftId = sftId;
      return this;
    }

    public ProofEnvelope build() {
      ProofEnvelope built = envelope;
      envelope = built.toBuilder().envelope;
      return built;
    }
  }
}
