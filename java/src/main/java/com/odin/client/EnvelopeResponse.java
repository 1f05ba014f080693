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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.odin.envelope.Verification;

/** The payload of a gateway response, together with the outcome of verifying its proof. */
public final class EnvelopeResponse {
  private static final Gson GSON = new Gson();

  private final JsonElement payload;
  private final Verification verification;

  EnvelopeResponse(JsonElement payload, Verification verification) {
    this.payload = payload;
    this.verification = verification;
  }

  public JsonElement getPayload() {
    return payload.deepCopy();
  }

  /** Binds the payload to {@code type} with Gson. */
  public <T> T getPayload(Class<T> type) {
    return GSON.fromJson(payload, type);
  }

  public Verification getVerification() {
    return verification;
  }
}
