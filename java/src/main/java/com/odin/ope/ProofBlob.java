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

package com.odin.ope;

import com.odin.util.Base64Url;
import com.odin.util.Result;
import java.util.Optional;

/**
 * The decoded {@code ope} field of an envelope: either a {@link StructuredProof} or the raw bytes
 * of a detached signature.
 */
public final class ProofBlob {
  public enum Kind {
    STRUCTURED,
    RAW
  }

  private final Kind kind;
  private final StructuredProof proof;
  private final byte[] raw;

  private ProofBlob(Kind kind, StructuredProof proof, byte[] raw) {
    this.kind = kind;
    this.proof = proof;
    this.raw = raw;
  }

  /**
   * Decodes an {@code ope} value. Valid base64url whose bytes form a structured proof is {@link
   * Kind#STRUCTURED}; everything else is {@link Kind#RAW}, with empty bytes when the value was
   * missing or not base64url.
   */
  public static ProofBlob decode(String ope) {
    Result<byte[], String> decoded = Base64Url.tryDecode(ope);
    if (decoded.isError()) {
      return new ProofBlob(Kind.RAW, null, new byte[0]);
    }
    byte[] bytes = decoded.success().get();
    Optional<StructuredProof> proof = StructuredProof.parse(bytes).success();
    if (proof.isPresent()) {
      return new ProofBlob(Kind.STRUCTURED, proof.get(), null);
    }
    return new ProofBlob(Kind.RAW, null, bytes);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @throws IllegalStateException if this is not a structured proof
   */
  public StructuredProof getStructuredProof() {
    if (kind != Kind.STRUCTURED) {
      throw new IllegalStateException("not a structured proof");
    }
    return proof;
  }

  /**
   * @throws IllegalStateException if this is a structured proof
   */
  public byte[] getRawSignature() {
    if (kind != Kind.RAW) {
      throw new IllegalStateException("not a raw signature");
    }
    return raw.clone();
  }
}
