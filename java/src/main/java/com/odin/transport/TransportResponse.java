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

import java.nio.charset.StandardCharsets;

/** Status code and body of an HTTP exchange. */
public final class TransportResponse {
  private final int statusCode;
  private final byte[] body;

  public TransportResponse(int statusCode, byte[] body) {
    this.statusCode = statusCode;
    this.body = body == null ? new byte[0] : body.clone();
  }

  public static TransportResponse ofString(int statusCode, String body) {
    return new TransportResponse(statusCode, body.getBytes(StandardCharsets.UTF_8));
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** True for 2xx status codes. */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  public byte[] getBody() {
    return body.clone();
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
