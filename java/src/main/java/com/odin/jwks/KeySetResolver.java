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

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Finds the key set that applies to an envelope and selects signing keys from it. */
public class KeySetResolver {
  private static final Logger logger = Logger.getLogger(KeySetResolver.class.getName());

  private final KeySetFetcher fetcher;

  public KeySetResolver(KeySetFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /**
   * Resolves a key set. The first source present wins; sources are never merged.
   *
   * @param explicit key set supplied by the caller
   * @param inline key set embedded in the envelope
   * @param url key set URL named by the envelope
   */
  public KeySetResolution resolve(
      Optional<KeySet> explicit, Optional<KeySet> inline, Optional<String> url) {
    if (explicit.isPresent()) {
      return KeySetResolution.resolved(explicit.get());
    }
    if (inline.isPresent()) {
      return KeySetResolution.resolved(inline.get());
    }
    if (url.isEmpty() || url.get().trim().isEmpty()) {
      return KeySetResolution.absent();
    }
    String location = url.get().trim();
    try {
      Optional<KeySet> fetched = fetcher.fetch(URI.create(location));
      if (fetched.isEmpty()) {
        logger.log(Level.WARNING, "no usable key set at {0}", location);
        return KeySetResolution.absent();
      }
      return KeySetResolution.resolved(fetched.get());
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "couldn't fetch key set from " + location, e);
      return KeySetResolution.fetchFailed(
          String.format("%s: %s", e.getClass().getSimpleName(), e.getMessage()));
    }
  }

  /**
   * Selects the Ed25519 key to verify with.
   *
   * <p>With a non-blank {@code kid} only an exact match (after trimming) is returned. Without one,
   * the first key marked for signatures wins, otherwise the first Ed25519 key.
   */
  public static Optional<Jwk> selectKey(KeySet keySet, String kid) {
    String wanted = kid == null ? "" : kid.trim();
    Jwk fallback = null;
    for (Jwk key : keySet.getKeys()) {
      if (!key.isEd25519Candidate()) {
        continue;
      }
      if (!wanted.isEmpty()) {
        if (key.getKid().map(String::trim).filter(wanted::equals).isPresent()) {
          return Optional.of(key);
        }
        continue;
      }
      if (key.getUse().filter(Jwk.USE_SIG::equals).isPresent()
          || key.getAlg().filter(Jwk.ALG_EDDSA::equals).isPresent()) {
        return Optional.of(key);
      }
      if (fallback == null) {
        fallback = key;
      }
    }
    return Optional.ofNullable(fallback);
  }
}
