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

package com.odin.envelope;

import com.google.common.base.Preconditions;
import com.odin.jwks.KeySet;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/** Per-call policy for {@link EnvelopeVerifier}. */
public final class VerifyOptions {
  private static final VerifyOptions DEFAULTS = newBuilder().build();

  private final String expectedContentId;
  private final KeySet keySet;
  private final boolean requireKeySet;
  private final Duration maxSkew;
  private final Clock clock;

  private VerifyOptions(Builder builder) {
    this.expectedContentId = builder.expectedContentId;
    this.keySet = builder.keySet;
    this.requireKeySet = builder.requireKeySet;
    this.maxSkew = builder.maxSkew;
    this.clock = builder.clock;
  }

  /** No expected identifier, no trusted keys, structured proofs self-authenticate. */
  public static VerifyOptions defaults() {
    return DEFAULTS;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Content identifier the caller expects; a different computed identifier fails. */
  public Optional<String> getExpectedContentId() {
    return Optional.ofNullable(expectedContentId);
  }

  /** Key set that takes precedence over anything the envelope names. */
  public Optional<KeySet> getKeySet() {
    return Optional.ofNullable(keySet);
  }

  /** Whether structured proofs must also be confirmed by a key set. */
  public boolean isRequireKeySet() {
    return requireKeySet;
  }

  public Optional<Duration> getMaxSkew() {
    return Optional.ofNullable(maxSkew);
  }

  public Clock getClock() {
    return clock;
  }

  public Builder toBuilder() {
    return new Builder()
        .setExpectedContentId(expectedContentId)
        .setKeySet(keySet)
        .setRequireKeySet(requireKeySet)
        .setMaxSkew(maxSkew)
        .setClock(clock);
  }

  public static final class Builder {
    private String expectedContentId;
    private KeySet keySet;
    private boolean requireKeySet;
    private Duration maxSkew;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder setExpectedContentId(String expectedContentId) {
      this.expectedContentId = expectedContentId;
      return this;
    }

    public Builder setKeySet(KeySet keySet) {
      this.keySet = keySet;
      return this;
    }

    public Builder setRequireKeySet(boolean requireKeySet) {
      this.requireKeySet = requireKeySet;
      return this;
    }

    /** Maximum distance between a structured proof's timestamp and now; null disables the check. */
    public Builder setMaxSkew(Duration maxSkew) {
      Preconditions.checkArgument(
          maxSkew == null || !maxSkew.isNegative(), "maxSkew must not be negative");
      this.maxSkew = maxSkew;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public VerifyOptions build() {
      return new VerifyOptions(this);
    }
  }
}
