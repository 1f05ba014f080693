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
import java.util.Optional;

/** Retrieves a published key set. */
public interface KeySetFetcher {
  /**
   * Fetches the key set at {@code uri}.
   *
   * @return the key set, or empty if the endpoint answered without a usable one
   * @throws IOException if the endpoint could not be reached in time
   */
  Optional<KeySet> fetch(URI uri) throws IOException;

  /** Returns a fetcher that never touches the network and always answers empty. */
  static KeySetFetcher disabled() {
    return uri -> Optional.empty();
  }
}
