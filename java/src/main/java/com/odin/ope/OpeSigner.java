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

import com.google.crypto.tink.subtle.Ed25519Sign;
import com.odin.cid.ContentAddresser;
import com.odin.jwks.Jwk;
import com.odin.util.Base64Url;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Produces Origin Proof Envelopes with an Ed25519 key. Used by producers and by tests that need
 * envelopes a verifier will accept.
 */
public final class OpeSigner {
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final Ed25519Sign signer;
  private final byte[] publicKey;
  private final String kid;
  private final Clock clock;

  private OpeSigner(Ed25519Sign.KeyPair keyPair, String kid, Clock clock)
      throws GeneralSecurityException {
    this.signer = new Ed25519Sign(keyPair.getPrivateKey());
    this.publicKey = keyPair.getPublicKey();
    this.kid = Objects.requireNonNull(kid, "kid");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Creates a signer with a fresh random key. */
  public static OpeSigner generate(String kid, Clock clock) throws GeneralSecurityException {
    return new OpeSigner(Ed25519Sign.KeyPair.newKeyPair(), kid, clock);
  }

  /** Creates a signer from a 32-byte Ed25519 seed. */
  public static OpeSigner fromSeed(byte[] seed, String kid, Clock clock)
      throws GeneralSecurityException {
    return new OpeSigner(Ed25519Sign.KeyPair.newKeyPairFromSeed(seed), kid, clock);
  }

  /** Signs {@code content} at the current time of the clock. */
  public StructuredProof sign(byte[] content, String contentId) throws GeneralSecurityException {
    Instant now = clock.instant();
    return sign(content, contentId, now.getEpochSecond() * NANOS_PER_SECOND + now.getNano());
  }

  /**
   * Signs {@code content} at an explicit timestamp.
   *
   * @param contentId bound into the signed message when non-null
   */
  public StructuredProof sign(byte[] content, String contentId, long tsNs)
      throws GeneralSecurityException {
    byte[] signature = signer.sign(OpeMessage.build(tsNs, content, contentId));
    return new StructuredProof(StructuredProof.VERSION, StructuredProof.ALGORITHM, tsNs, kid,
        Base64Url.encode(publicKey), ContentAddresser.blake3Base64Url(content),
        Base64Url.encode(signature), contentId);
  }

  /** Returns a bare detached signature over {@code content}, without OPE framing. */
  public byte[] signRaw(byte[] content) throws GeneralSecurityException {
    return signer.sign(content);
  }

  /** Returns the key record a verifier needs to trust this signer. */
  public Jwk toJwk() {
    return Jwk.ed25519(publicKey, kid);
  }

  public byte[] getPublicKey() {
    return publicKey.clone();
  }

  public String getKid() {
    return kid;
  }
}
