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

import com.google.common.collect.ImmutableMap;
import com.odin.transport.HttpTransport;
import com.odin.transport.TransportResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Fetches key sets with a GET over an {@link HttpTransport}. */
public final class HttpKeySetFetcher implements KeySetFetcher {
  private static final Logger logger = Logger.getLogger(HttpKeySetFetcher.class.getName());

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final HttpTransport transport;
  private final Duration timeout;

  public HttpKeySetFetcher(HttpTransport transport) {
    this(transport, DEFAULT_TIMEOUT);
  }

  public HttpKeySetFetcher(HttpTransport transport, Duration timeout) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Optional<KeySet> fetch(URI uri) throws IOException {
    TransportResponse response =
        transport.get(uri, ImmutableMap.of("Accept", "application/json"), timeout);
    if (!response.isSuccess()) {
      logger.log(Level.WARNING, "key set endpoint {0} answered {1}",
          new Object[] {uri, response.getStatusCode()});
      return Optional.empty();
    }
    Optional<KeySet> keySet = KeySet.fromJson(response.getBodyAsString());
    if (keySet.isEmpty()) {
      logger.log(Level.WARNING, "key set endpoint {0} returned a body without keys", uri);
    }
    return keySet;
  }
}
