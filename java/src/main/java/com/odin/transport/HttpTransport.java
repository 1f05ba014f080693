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
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * An interface for talking HTTP to an ODIN gateway. Every component that needs the network receives
 * an instance explicitly.
 */
public interface HttpTransport {
  /**
   * Sends a GET request.
   *
   * @param uri absolute request URI
   * @param headers request headers
   * @param timeout upper bound for the whole exchange
   * @return the response, whatever its status code
   * @throws IOException on transport failure or timeout
   */
  TransportResponse get(URI uri, Map<String, String> headers, Duration timeout) throws IOException;

  /**
   * Sends a POST request.
   *
   * @param uri absolute request URI
   * @param headers request headers
   * @param body request body
   * @param timeout upper bound for the whole exchange
   * @return the response, whatever its status code
   * @throws IOException on transport failure or timeout
   */
  TransportResponse post(URI uri, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException;
}
