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

import java.util.Objects;
import java.util.Optional;

/** Outcome of looking up the key set for an envelope. */
public final class KeySetResolution {
  /** How the lookup ended. */
  public enum Status {
    /** A key set was supplied or fetched. */
    RESOLVED,
    /** Nothing was supplied, or the endpoint had no usable key set. */
    ABSENT,
    /** The endpoint could not be reached. */
    FETCH_FAILED
  }

  private static final KeySetResolution ABSENT = new KeySetResolution(Status.ABSENT, null, null);

  private final Status status;
  private final KeySet keySet;
  private final String detail;

  private KeySetResolution(Status status, KeySet keySet, String detail) {
    this.status = status;
    this.keySet = keySet;
    this.detail = detail;
  }

  public static KeySetResolution resolved(KeySet keySet) {
    return new KeySetResolution(Status.RESOLVED, Objects.requireNonNull(keySet), null);
  }

  public static KeySetResolution absent() {
    return ABSENT;
  }

  public static KeySetResolution fetchFailed(String detail) {
    return new KeySetResolution(Status.FETCH_FAILED, null, detail);
  }

  public Status getStatus() {
    return status;
  }

  /** Returns the key set if {@link Status#RESOLVED}. */
  public Optional<KeySet> getKeySet() {
    return Optional.ofNullable(keySet);
  }

  public Optional<String> getDetail() {
    return Optional.ofNullable(detail);
  }

  @Override
  public String toString() {
    return status + (detail == null ? "" : "(" + detail + ")");
  }
}
