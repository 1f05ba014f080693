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

import com.google.crypto.tink.subtle.Ed25519Verify;
import java.security.GeneralSecurityException;

public class Ed25519SignatureVerifier {
  public static final int PUBLIC_KEY_LENGTH = 32;
  public static final int SIGNATURE_LENGTH = 64;

  private final Ed25519Verify verifier;

  /**
   * Creates an Ed25519 signature verifier.
   *
   * @param publicKey raw 32-byte Ed25519 public key, as carried in {@code x} and {@code pub_b64u}
   * @throws GeneralSecurityException if the key has the wrong length
   */
  public Ed25519SignatureVerifier(byte[] publicKey) throws GeneralSecurityException {
    if (publicKey == null || publicKey.length != PUBLIC_KEY_LENGTH) {
      throw new GeneralSecurityException(String.format("Ed25519 public key must be %d bytes, got %d",
          PUBLIC_KEY_LENGTH, publicKey == null ? 0 : publicKey.length));
    }
    verifier = new Ed25519Verify(publicKey);
  }

  /**
   * Verifies the {@code signature} value over {@code input} data.
   *
   * @param signature 64-byte detached Ed25519 signature
   */
  public boolean verify(byte[] input, byte[] signature) {
    if (signature == null || signature.length != SIGNATURE_LENGTH) {
      return false;
    }
    try {
      verifier.verify(signature, input);
      return true;
    } catch (GeneralSecurityException e) {
      return false;
    }
  }

  /** Verifies without throwing: a malformed key or signature simply does not verify. */
  public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
    try {
      return new Ed25519SignatureVerifier(publicKey).verify(message, signature);
    } catch (GeneralSecurityException e) {
      return false;
    }
  }
}
