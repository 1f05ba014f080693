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

package com.odin.client;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.odin.util.Result;
import java.util.Map;
import java.util.Optional;

/** The gateway discovery document served at {@value #WELL_KNOWN_PATH}. */
public final class Discovery {
  public static final String WELL_KNOWN_PATH = "/.well-known/odin/discovery.json";

  private final String keySetUrl;
  private final ImmutableMap<String, String> endpoints;
  private final JsonObject policy;
  private final JsonObject protocol;
  private final JsonObject raw;

  private Discovery(String keySetUrl, ImmutableMap<String, String> endpoints, JsonObject policy,
      JsonObject protocol, JsonObject raw) {
    this.keySetUrl = keySetUrl;
    this.endpoints = endpoints;
    this.policy = policy;
    this.protocol = protocol;
    this.raw = raw;
  }

  /**
   * Reads a discovery document. The key set URL comes from {@code jwks_url}, falling back to
   * {@code endpoints.jwks}; a document naming neither is an error.
   */
  public static Result<Discovery, String> fromJson(JsonElement json) {
    if (json == null || !json.isJsonObject()) {
      return Result.error("discovery document is not a JSON object");
    }
    JsonObject object = json.getAsJsonObject();
    ImmutableMap.Builder<String, String> endpoints = ImmutableMap.builder();
    JsonElement endpointsJson = object.get("endpoints");
    if (endpointsJson != null && endpointsJson.isJsonObject()) {
      for (Map.Entry<String, JsonElement> entry : endpointsJson.getAsJsonObject().entrySet()) {
        if (isString(entry.getValue())) {
          endpoints.put(entry.getKey(), entry.getValue().getAsString());
        }
      }
    }
    ImmutableMap<String, String> endpointMap = endpoints.build();

    String keySetUrl = isString(object.get("jwks_url")) ? object.get("jwks_url").getAsString() : "";
    if (keySetUrl.isEmpty()) {
      keySetUrl = endpointMap.getOrDefault("jwks", "");
    }
    if (keySetUrl.isEmpty()) {
      return Result.error("discovery document has no jwks_url");
    }
    return Result.success(new Discovery(keySetUrl, endpointMap, objectMember(object, "policy"),
        objectMember(object, "protocol"), object.deepCopy()));
  }

  public String getKeySetUrl() {
    return keySetUrl;
  }

  public ImmutableMap<String, String> getEndpoints() {
    return endpoints;
  }

  public Optional<JsonObject> getPolicy() {
    return Optional.ofNullable(policy).map(JsonObject::deepCopy);
  }

  public Optional<JsonObject> getProtocol() {
    return Optional.ofNullable(protocol).map(JsonObject::deepCopy);
  }

  /** The proof version the gateway announces under {@code protocol.proof_version}. */
  public Optional<String> getProofVersion() {
    return protocol != null && isString(protocol.get("proof_version"))
        ? Optional.of(protocol.get("proof_version").getAsString())
        : Optional.empty();
  }

  /** The document as served. */
  public JsonObject getRaw() {
    return raw.deepCopy();
  }

  private static boolean isString(JsonElement element) {
    return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
  }

  private static JsonObject objectMember(JsonObject json, String name) {
    JsonElement element = json.get(name);
    return element != null && element.isJsonObject() ? element.getAsJsonObject().deepCopy() : null;
  }
}
