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
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.odin.transport.HttpTransport;
import com.odin.transport.TransportResponse;
import com.odin.util.Result;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Fetches a gateway's discovery document. */
public final class DiscoveryClient {
  private static final Logger logger = Logger.getLogger(DiscoveryClient.class.getName());

  private final HttpTransport transport;
  private final Duration timeout;

  public DiscoveryClient(HttpTransport transport, Duration timeout) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Fetches and validates {@code {baseUrl}/.well-known/odin/discovery.json}.
   *
   * @throws IOException if the gateway cannot be reached, answers with a non-2xx status, or serves
   *     a document that is not JSON or names no key set URL
   */
  public Discovery fetch(String baseUrl) throws IOException {
    URI uri;
    try {
      uri = URI.create(stripTrailingSlashes(baseUrl) + Discovery.WELL_KNOWN_PATH);
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid gateway URL " + baseUrl, e);
    }
    TransportResponse response =
        transport.get(uri, ImmutableMap.of("Accept", "application/json"), timeout);
    if (!response.isSuccess()) {
      throw new IOException(
          String.format("discovery at %s answered HTTP %d", uri, response.getStatusCode()));
    }
    JsonElement json;
    try {
      json = JsonParser.parseString(response.getBodyAsString());
    } catch (JsonParseException e) {
      throw new IOException("discovery document at " + uri + " is not JSON", e);
    }
    Result<Discovery, String> discovery = Discovery.fromJson(json);
    if (discovery.isError()) {
      throw new IOException(String.format("%s: %s", uri, discovery.error().get()));
    }
    logger.log(Level.INFO, "discovered gateway {0}, key set at {1}",
        new Object[] {baseUrl, discovery.success().get().getKeySetUrl()});
    return discovery.success().get();
  }

  static String stripTrailingSlashes(String url) {
    int end = url.length();
    while (end > 0 && url.charAt(end - 1) == '/') {
      end--;
    }
    return url.substring(0, end);
  }
}
