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


package com.odin.util;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;

/**
 * Parses JSON text without Gson's lenient extensions: no single-quoted or unquoted strings, no
 * comments, no NaN, exactly one value.
 */
public final class StrictJson {
  private static final TypeAdapter<JsonElement> ADAPTER = new Gson().getAdapter(JsonElement.class);

  public static Result<JsonElement, String> parse(String text) {
    JsonReader reader = new JsonReader(new StringReader(text));
    reader.setLenient(false);
    try {
      JsonElement element = ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        return Result.error("trailing data after JSON value");
      }
      return Result.success(element);
    } catch (IOException | IllegalStateException | JsonParseException e) {
      return Result.error("invalid JSON: " + e.getMessage());
    }
  }

  private StrictJson() {}
}
