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

import com.google.common.base.Preconditions;
import com.odin.envelope.VerifyOptions;
import com.odin.jwks.HttpKeySetFetcher;
import com.odin.jwks.KeySetFetcher;
import com.odin.transport.HttpTransport;
import com.odin.transport.JdkHttpTransport;
import java.time.Duration;
import java.util.Objects;

/** Settings for {@link OdinClient}. */
public final class ClientOptions {
  public static final String DEFAULT_ACCEPT_PROOF = "embed,headers";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final boolean requireProof;
  private final String acceptProof;
  private final HttpTransport transport;
  private final KeySetFetcher keySetFetcher;
  private final VerifyOptions verifyOptions;
  private final Duration timeout;

  private ClientOptions(Builder builder) {
    this.requireProof = builder.requireProof;
    this.acceptProof = builder.acceptProof;
    this.transport = builder.transport != null ? builder.transport : JdkHttpTransport.create();
    this.keySetFetcher = builder.keySetFetcher != null
        ? builder.keySetFetcher
        : new HttpKeySetFetcher(transport, HttpKeySetFetcher.DEFAULT_TIMEOUT);
    this.verifyOptions = builder.verifyOptions;
    this.timeout = builder.timeout;
  }

  public static ClientOptions defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Whether a missing or invalid proof fails the call. Defaults to true. */
  public boolean isRequireProof() {
    return requireProof;
  }

  /** Value of {@code X-ODIN-Accept-Proof}; empty means the header is not sent. */
  public String getAcceptProof() {
    return acceptProof;
  }

  public HttpTransport getTransport() {
    return transport;
  }

  public KeySetFetcher getKeySetFetcher() {
    return keySetFetcher;
  }

  public VerifyOptions getVerifyOptions() {
    return verifyOptions;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public static final class Builder {
    private boolean requireProof = true;
    private String acceptProof = DEFAULT_ACCEPT_PROOF;
    private HttpTransport transport;
    private KeySetFetcher keySetFetcher;
    private VerifyOptions verifyOptions = VerifyOptions.defaults();
    private Duration timeout = DEFAULT_TIMEOUT;

    private Builder() {}

    public Builder setRequireProof(boolean requireProof) {
      this.requireProof = requireProof;
      return this;
    }

    public Builder setAcceptProof(String acceptProof) {
      this.acceptProof = acceptProof == null ? "" : acceptProof;
      return this;
    }

    public Builder setTransport(HttpTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Overrides how key sets named by envelopes are fetched; defaults to the transport. */
    public Builder setKeySetFetcher(KeySetFetcher keySetFetcher) {
      this.keySetFetcher = Objects.requireNonNull(keySetFetcher, "keySetFetcher");
      return this;
    }

    public Builder setVerifyOptions(VerifyOptions verifyOptions) {
      this.verifyOptions = Objects.requireNonNull(verifyOptions, "verifyOptions");
      return this;
    }

    public Builder setTimeout(Duration timeout) {
      Preconditions.checkArgument(
          timeout != null && !timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
      this.timeout = timeout;
      return this;
    }

    public ClientOptions build() {
      return new ClientOptions(this);
    }
  }
}
