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

package com.odin.testing;

import com.odin.transport.HttpTransport;
import com.odin.transport.TransportResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** In-memory {@link HttpTransport} serving canned responses and recording requests. */
public class FakeHttpTransport implements HttpTransport {
  /** A request seen by the transport. */
  public static class Request {
    public final String method;
    public final URI uri;
    public final Map<String, String> headers;
    public final String body;

    Request(String method, URI uri, Map<String, String> headers, String body) {
      this.method = method;
      this.uri = uri;
      this.headers = new HashMap<>(headers);
      this.body = body;
    }
  }

  private final Map<String, TransportResponse> responses = new HashMap<>();
  private final Map<String, IOException> failures = new HashMap<>();
  private final List<Request> requests = new ArrayList<>();

  public FakeHttpTransport respond(String uri, int status, String body) {
    responses.put(uri, TransportResponse.ofString(status, body));
    return this;
  }

  public FakeHttpTransport fail(String uri, IOException failure) {
    failures.put(uri, failure);
    return this;
  }

  public List<Request> getRequests() {
    return requests;
  }

  public Request lastRequest() {
    return requests.get(requests.size() - 1);
  }

  @Override
  public TransportResponse get(URI uri, Map<String, String> headers, Duration timeout)
      throws IOException {
    return serve(new Request("GET", uri, headers, null));
  }

  @Override
  public TransportResponse post(URI uri, Map<String, String> headers, byte[] body,
      Duration timeout) throws IOException {
    return serve(new Request("POST", uri, headers, new String(body, StandardCharsets.UTF_8)));
  }

  private TransportResponse serve(Request request) throws IOException {
    requests.add(request);
    String key = request.uri.toString();
    if (failures.containsKey(key)) {
      throw failures.get(key);
    }
    TransportResponse response = responses.get(key);
    return response != null ? response : TransportResponse.ofString(404, "not found");
  }
}
