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

import java.util.Optional;

/** Why an envelope did not verify. Each reason has a stable wire code. */
public enum FailureReason {
  /** The envelope carries no decodable content bytes. */
  MISSING_CONTENT("missing_oml_c"),
  /** The content does not hash to the identifier the caller expected. */
  CID_MISMATCH("cid_mismatch"),
  /** A structured proof does not verify against its own public key. */
  VERIFY_FAILED("verify_failed"),
  /** The key set has the proof's kid, but with different key material. */
  PUBKEY_MISMATCH("jwks_pub_mismatch"),
  KID_NOT_FOUND("kid_not_in_jwks"),
  /** A raw signature is not 64 bytes long. */
  INVALID_SIGNATURE_FORMAT("invalid_ope_format"),
  NO_KEY_SET("no_jwks"),
  /** The selected key does not decode to 32 bytes. */
  INVALID_KEY("invalid_jwk_x"),
  /** A raw signature does not verify against the selected key. */
  SIGNATURE_INVALID("signature_invalid"),
  KEY_SET_FETCH_FAILED("jwks_fetch_failed"),
  /** The proof timestamp is further from the current time than allowed. */
  TIMESTAMP_SKEW("ts_skew"),
  /** A response carried no proof at all. */
  MISSING_PROOF("no_proof");

  private final String code;

  FailureReason(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public static Optional<FailureReason> fromCode(String code) {
    for (FailureReason reason : values()) {
      if (reason.code.equals(code)) {
        return Optional.of(reason);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return code;
  }
}
