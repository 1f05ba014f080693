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

import com.google.common.io.BaseEncoding;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.odin.util.Base64Url;
import com.odin.util.Result;
import com.odin.util.StrictJson;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/** Loads trusted key sets from configuration: URLs, inline JSON, files and environment variables. */
public final class KeySetLoader {
  private static final Logger logger = Logger.getLogger(KeySetLoader.class.getName());

  public static final String JWKS_ENV = "ODIN_OPE_JWKS";
  public static final String JWKS_PATH_ENV = "ODIN_OPE_JWKS_PATH";
  public static final String PUBKEY_ENV = "ODIN_OPE_PUBKEY";
  public static final String KID_ENV = "ODIN_OPE_KID";
  public static final String DEFAULT_ENV_KID = "env:default";

  private static final Pattern HEX_KEY = Pattern.compile("[0-9a-fA-F]{64}");

  /**
   * Loads a key set from {@code source}: an {@code http(s)://} URL is fetched, text that starts
   * like a JSON object is parsed inline, anything else is read as a file path. Inline and file
   * sources are parsed with {@link #parseStrict(String)}.
   *
   * @throws IOException if the URL or file cannot be read, or the URL serves no key set
   * @throws IllegalArgumentException if inline or file content is not a valid key set
   */
  public static KeySet load(String source, KeySetFetcher fetcher) throws IOException {
    String trimmed = source.trim();
    String lower = trimmed.toLowerCase();
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      Optional<KeySet> fetched = fetcher.fetch(URI.create(trimmed));
      if (fetched.isEmpty()) {
        throw new IOException("no key set served at " + trimmed);
      }
      return fetched.get();
    }
    if (trimmed.startsWith("{")) {
      return parseStrict(trimmed);
    }
    return parseStrict(Files.readString(Paths.get(trimmed), StandardCharsets.UTF_8));
  }

  /**
   * Builds the trusted key set from environment variables. {@code ODIN_OPE_JWKS} (inline JSON)
   * takes precedence over {@code ODIN_OPE_JWKS_PATH} (file), which takes precedence over a single
   * {@code ODIN_OPE_PUBKEY} (hex, base64 or base64url) named by {@code ODIN_OPE_KID}.
   *
   * @return the configured key set, or an empty one if nothing is configured
   * @throws IOException if the configured file cannot be read
   * @throws IllegalArgumentException if the configured value is malformed
   */
  public static KeySet fromEnvironment(Map<String, String> env) throws IOException {
    String inline = nonBlank(env.get(JWKS_ENV));
    if (inline != null) {
      return parseStrict(inline);
    }
    String path = nonBlank(env.get(JWKS_PATH_ENV));
    if (path != null) {
      Path file = Paths.get(path);
      logger.log(Level.FINE, "loading key set from {0}", file);
      return parseStrict(Files.readString(file, StandardCharsets.UTF_8));
    }
    String pubkey = nonBlank(env.get(PUBKEY_ENV));
    if (pubkey != null) {
      String kid = nonBlank(env.get(KID_ENV));
      return KeySet.of(Jwk.ed25519(decodeKey(pubkey), kid == null ? DEFAULT_ENV_KID : kid));
    }
    return KeySet.empty();
  }

  /**
   * Parses a key set that is going to be trusted. Every entry must be an OKP / Ed25519 object
   * whose {@code x} decodes to 32 bytes; kids and key material must be unique.
   *
   * @throws IllegalArgumentException naming the first offending entry
   */
  public static KeySet parseStrict(String json) {
    Result<JsonElement, String> parsed = StrictJson.parse(json);
    if (parsed.isError()) {
      throw new IllegalArgumentException("key set is not valid JSON: " + parsed.error().get());
    }
    JsonElement root = parsed.success().get();
    if (!root.isJsonObject() || !root.getAsJsonObject().has("keys")
        || !root.getAsJsonObject().get("keys").isJsonArray()) {
      throw new IllegalArgumentException("key set must be an object with a 'keys' array");
    }
    List<Jwk> keys = new ArrayList<>();
    Set<String> kids = new HashSet<>();
    Set<String> material = new HashSet<>();
    int index = 0;
    for (JsonElement entry : root.getAsJsonObject().getAsJsonArray("keys")) {
      if (!entry.isJsonObject()) {
        throw new IllegalArgumentException(String.format("keys[%d] is not an object", index));
      }
      JsonObject object = entry.getAsJsonObject();
      Jwk key = Jwk.fromJson(object);
      if (!Jwk.KTY_OKP.equals(key.getKty()) || !Jwk.CRV_ED25519.equals(key.getCrv())) {
        throw new IllegalArgumentException(
            String.format("keys[%d] is not an OKP/Ed25519 key", index));
      }
      Result<byte[], String> publicKey = key.decodePublicKey();
      if (publicKey.isError()) {
        throw new IllegalArgumentException(
            String.format("keys[%d].x: %s", index, publicKey.error().get()));
      }
      if (key.getKid().isPresent() && !kids.add(key.getKid().get().trim())) {
        throw new IllegalArgumentException(
            String.format("keys[%d] repeats kid '%s'", index, key.getKid().get()));
      }
      if (!material.add(Base64Url.encode(publicKey.success().get()))) {
        throw new IllegalArgumentException(String.format("keys[%d] repeats key material", index));
      }
      keys.add(key);
      index++;
    }
    return KeySet.of(keys);
  }

  /** Decodes a 32-byte Ed25519 public key given as hex, base64 or base64url. */
  static byte[] decodeKey(String value) {
    String trimmed = value.trim();
    byte[] key;
    if (HEX_KEY.matcher(trimmed).matches()) {
      key = BaseEncoding.base16().decode(trimmed.toUpperCase());
    } else {
      try {
        key = Base64Url.decode(trimmed);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(PUBKEY_ENV + " is neither hex nor base64", e);
      }
    }
    if (key.length != 32) {
      throw new IllegalArgumentException(
          String.format("%s must be a 32-byte Ed25519 key, got %d bytes", PUBKEY_ENV, key.length));
    }
    return key;
  }

  private static String nonBlank(String value) {
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  private KeySetLoader() {}
}
