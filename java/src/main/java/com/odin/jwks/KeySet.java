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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.odin.util.StrictJson;
import java.util.List;
import java.util.Optional;

/** An ordered, immutable collection of public key records, as served at a JWKS endpoint. */
public final class KeySet {
  private static final KeySet EMPTY = new KeySet(ImmutableList.of());

  private final ImmutableList<Jwk> keys;

  private KeySet(ImmutableList<Jwk> keys) {
    this.keys = keys;
  }

  public static KeySet of(List<Jwk> keys) {
    return new KeySet(ImmutableList.copyOf(keys));
  }

  public static KeySet of(Jwk... keys) {
    return new KeySet(ImmutableList.copyOf(keys));
  }

  public static KeySet empty() {
    return EMPTY;
  }

  /**
   * Parses a {@code {"keys": [...]}} document leniently. Entries that are not objects are skipped.
   *
   * @return empty if {@code json} is not an object with a {@code keys} array
   */
  public static Optional<KeySet> fromJson(JsonElement json) {
    if (json == null || !json.isJsonObject()) {
      return Optional.empty();
    }
    JsonElement keys = json.getAsJsonObject().get("keys");
    if (keys == null || !keys.isJsonArray()) {
      return Optional.empty();
    }
    ImmutableList.Builder<Jwk> builder = ImmutableList.builder();
    for (JsonElement entry : keys.getAsJsonArray()) {
      if (entry.isJsonObject()) {
        builder.add(Jwk.fromJson(entry.getAsJsonObject()));
      }
    }
    return Optional.of(new KeySet(builder.build()));
  }

  /** Same as {@link #fromJson(JsonElement)}, also returning empty for text that is not JSON. */
  public static Optional<KeySet> fromJson(String json) {
    return StrictJson.parse(json).success().flatMap(element -> fromJson(element));
  }

  public JsonObject toJson() {
    JsonArray array = new JsonArray();
    for (Jwk key : keys) {
      array.add(key.toJson());
    }
    JsonObject json = new JsonObject();
    json.add("keys", array);
    return json;
  }

  public ImmutableList<Jwk> getKeys() {
    return keys;
  }

  public boolean isEmpty() {
    return keys.isEmpty();
  }

  public int size() {
    return keys.size();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof KeySet && keys.equals(((KeySet) o).keys));
  }

  @Override
  public int hashCode() {
    return keys.hashCode();
  }

  @Override
  public String toString() {
    return "KeySet" + keys;
  }
}
