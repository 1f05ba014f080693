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

import com.odin.envelope.FailureReason;
import com.odin.envelope.Verification;
import java.security.GeneralSecurityException;
import java.util.Optional;

/** Thrown when a response that must be proven is not. */
public class ProofVerificationException extends GeneralSecurityException {
  private static final long serialVersionUID = 1L;

  private final transient Verification verification;

  /** A response that carried no proof. */
  public ProofVerificationException(String message) {
    super(message);
    this.verification = null;
  }

  /** A response whose proof did not verify. */
  public ProofVerificationException(Verification verification) {
    super("ODIN proof verification failed: "
        + verification.getFailureReason().map(FailureReason::getCode).orElse("unknown"));
    this.verification = verification;
  }

  public Optional<FailureReason> getFailureReason() {
    return getVerification().flatMap(Verification::getFailureReason);
  }

  public Optional<Verification> getVerification() {
    return Optional.ofNullable(verification);
  }
}
