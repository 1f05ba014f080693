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

package com.odin.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** {@link HttpTransport} backed by the JDK {@link HttpClient}. */
public final class JdkHttpTransport implements HttpTransport {
  private static final Logger logger = Logger.getLogger(JdkHttpTransport.class.getName());

  private final HttpClient client;

  public JdkHttpTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /** Creates a transport with a fresh client that follows same-protocol redirects. */
  public static JdkHttpTransport create() {
    return new JdkHttpTransport(
        HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
  }

  @Override
  public TransportResponse get(URI uri, Map<String, String> headers, Duration timeout)
      throws IOException {
    return send(newRequest(uri, headers, timeout).GET());
  }

  @Override
  public TransportResponse post(URI uri, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException {
    return send(
        newRequest(uri, headers, timeout).POST(HttpRequest.BodyPublishers.ofByteArray(body)));
  }

  private static HttpRequest.Builder newRequest(
      URI uri, Map<String, String> headers, Duration timeout) throws IOException {
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);
      for (Map.Entry<String, String> header : headers.entrySet()) {
        builder.header(header.getKey(), header.getValue());
      }
      return builder;
    } catch (IllegalArgumentException e) {
      throw new IOException(String.format("cannot build request for %s: %s", uri, e.getMessage()), e);
    }
  }

  private TransportResponse send(HttpRequest.Builder builder) throws IOException {
    HttpRequest request = builder.build();
    try {
      HttpResponse<byte[]> response =
          client.send(request, HttpResponse.BodyHandlers.ofByteArray());
      logger.log(Level.FINE, "{0} {1} -> {2}",
          new Object[] {request.method(), request.uri(), response.statusCode()});
      return new TransportResponse(response.statusCode(), response.body());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("interrupted while waiting for " + request.uri());
      interrupted.initCause(e);
      throw interrupted;
    }
  }
}
