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

package com.odin.cid;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes structured values into canonical JSON bytes: object keys sorted by code point at every
 * level, no insignificant whitespace, UTF-8, terminated by a single newline.
 *
 * <p>Only needed when a caller holds a structured value rather than the exact signed bytes.
 */
public final class Canonicalizer {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Integer.compare(a.length() - i, b.length() - j);
  };

  /**
   * Canonicalizes a value. {@link JsonElement} instances are used as-is; any other object is first
   * converted with Gson's default reflective mapping.
   *
   * @param value the value to serialize, may be null
   * @return canonical UTF-8 bytes ending in {@code '\n'}
   */
  public static byte[] canonicalize(Object value) {
    JsonElement tree = value instanceof JsonElement ? (JsonElement) value : GSON.toJsonTree(value);
    return (GSON.toJson(sorted(tree)) + "\n").getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Parses {@code json} and canonicalizes it.
   *
   * @throws com.google.gson.JsonParseException if {@code json} is not valid JSON
   */
  public static byte[] canonicalizeJson(String json) {
    return canonicalize(JsonParser.parseString(json));
  }

  /** Canonicalizes {@code value} and returns the content identifier of the result. */
  public static String computeContentId(Object value) {
    return ContentAddresser.computeContentId(canonicalize(value));
  }

  private static JsonElement sorted(JsonElement element) {
    if (element.isJsonObject()) {
      JsonObject source = element.getAsJsonObject();
      List<String> keys = new ArrayList<>(source.keySet());
      keys.sort(CODE_POINT_ORDER);
      JsonObject result = new JsonObject();
      for (String key : keys) {
        result.add(key, sorted(source.get(key)));
      }
      return result;
    }
    if (element.isJsonArray()) {
      JsonArray result = new JsonArray();
      for (JsonElement item : element.getAsJsonArray()) {
        result.add(sorted(item));
      }
      return result;
    }
    return element;
  }

  private Canonicalizer() {}
}
