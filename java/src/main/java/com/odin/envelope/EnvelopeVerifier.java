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

import com.odin.cid.ContentAddresser;
import com.odin.jwks.Jwk;
import com.odin.jwks.KeySet;
import com.odin.jwks.KeySetFetcher;
import com.odin.jwks.KeySetResolution;
import com.odin.jwks.KeySetResolver;
import com.odin.ope.Ed25519SignatureVerifier;
import com.odin.ope.ProofBlob;
import com.odin.ope.StructuredProof;
import com.odin.util.Base64Url;
import com.odin.util.Result;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Verifies proof envelopes.
 *
 * <p>The content identifier is always recomputed from the content bytes; the identifier the
 * envelope claims is only a label. Structured proofs are checked against their embedded public key
 * and, when a key set can be found, cross-checked against it. Raw signatures need a key set.
 *
 * <p>Malformed input never throws; every problem is reported as a {@link FailureReason}.
 */
public class EnvelopeVerifier {
  private static final Logger logger = Logger.getLogger(EnvelopeVerifier.class.getName());

  private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

  private final KeySetResolver resolver;

  public EnvelopeVerifier(KeySetFetcher fetcher) {
    this(new KeySetResolver(fetcher));
  }

  public EnvelopeVerifier(KeySetResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /** Creates a verifier that never fetches key sets. */
  public static EnvelopeVerifier offline() {
    return new EnvelopeVerifier(KeySetFetcher.disabled());
  }

  public Verification verify(ProofEnvelope envelope, VerifyOptions options) {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(options, "options");
    Verification result = evaluate(envelope, options);
    if (result.isOk()) {
      logger.log(Level.FINE, "envelope {0} verified with kid {1}",
          new Object[] {result.getContentId().orElse(null), result.getKid().orElse(null)});
    } else {
      logger.log(Level.FINE, "envelope {0} failed verification: {1}",
          new Object[] {result.getContentId().orElse(null), result.getFailureReason().get()});
    }
    return result;
  }

  private Verification evaluate(ProofEnvelope envelope, VerifyOptions options) {
    String envelopeKid = envelope.getKid().orElse(null);

    Optional<byte[]> content = envelope.getContent().flatMap(c -> Base64Url.tryDecode(c).success());
    if (content.isEmpty()) {
      return Verification.failure(null, envelopeKid, FailureReason.MISSING_CONTENT);
    }

    String contentId = ContentAddresser.computeContentId(content.get());
    Optional<String> expected = options.getExpectedContentId();
    if (expected.isPresent() && !expected.get().equals(contentId)) {
      return Verification.failure(contentId, envelopeKid, FailureReason.CID_MISMATCH,
          String.format("expected %s", expected.get()));
    }
    String labelMismatch = envelope.getContentId()
                               .filter(label -> !label.equals(contentId))
                               .map(label -> String.format(
                                   "envelope claims oml_cid %s, content hashes to %s", label,
                                   contentId))
                               .orElse(null);

    ProofBlob blob = ProofBlob.decode(envelope.getProof().orElse(null));
    switch (blob.getKind()) {
      case STRUCTURED:
        return verifyStructured(
            envelope, blob.getStructuredProof(), content.get(), contentId, labelMismatch, options);
      case RAW:
        return verifyRaw(
            envelope, blob.getRawSignature(), content.get(), contentId, labelMismatch, options);
      default:
        throw new AssertionError("unknown proof kind " + blob.getKind());
    }
  }

  private Verification verifyStructured(ProofEnvelope envelope, StructuredProof proof,
      byte[] content, String contentId, String labelMismatch, VerifyOptions options) {
    String kid = proof.getKid();
    if (proof.getVersion() != StructuredProof.VERSION
        || !StructuredProof.ALGORITHM.equals(proof.getAlgorithm())) {
      return Verification.failure(contentId, kid, FailureReason.VERIFY_FAILED,
          String.format("unsupported proof v=%d alg=%s", proof.getVersion(), proof.getAlgorithm()));
    }

    Result<byte[], String> publicKey = Base64Url.tryDecode(proof.getPublicKey());
    Result<byte[], String> signature = Base64Url.tryDecode(proof.getSignature());
    if (publicKey.isError() || signature.isError()
        || !Ed25519SignatureVerifier.verify(
            publicKey.success().get(), proof.message(content), signature.success().get())) {
      return Verification.failure(contentId, kid, FailureReason.VERIFY_FAILED, labelMismatch);
    }

    Optional<Duration> maxSkew = options.getMaxSkew();
    if (maxSkew.isPresent()) {
      BigInteger skew = nanos(options.getClock().instant())
                            .subtract(new BigInteger(Long.toUnsignedString(proof.getTimestampNs())))
                            .abs();
      if (skew.compareTo(nanos(maxSkew.get())) > 0) {
        return Verification.failure(contentId, kid, FailureReason.TIMESTAMP_SKEW,
            String.format("proof timestamp is %s ns away from now", skew));
      }
    }

    KeySetResolution resolution = resolver.resolve(
        options.getKeySet(), envelope.getInlineKeySet(), envelope.getKeySetUrl());
    Optional<KeySet> keySet = resolution.getKeySet();
    if (keySet.isEmpty()) {
      if (!options.isRequireKeySet()) {
        return Verification.success(contentId, kid);
      }
      return resolution.getStatus() == KeySetResolution.Status.FETCH_FAILED
          ? Verification.failure(contentId, kid, FailureReason.KEY_SET_FETCH_FAILED,
              resolution.getDetail().orElse(null))
          : Verification.failure(contentId, kid, FailureReason.NO_KEY_SET);
    }

    Optional<Jwk> key = KeySetResolver.selectKey(keySet.get(), kid);
    if (key.isEmpty()) {
      return Verification.failure(contentId, kid, FailureReason.KID_NOT_FOUND);
    }
    Optional<byte[]> published = key.get().decodePublicKey().success();
    if (published.isEmpty() || !MessageDigest.isEqual(published.get(), publicKey.success().get())) {
      return Verification.failure(contentId, kid, FailureReason.PUBKEY_MISMATCH);
    }
    return Verification.success(contentId, kid);
  }

  private Verification verifyRaw(ProofEnvelope envelope, byte[] signature, byte[] content,
      String contentId, String labelMismatch, VerifyOptions options) {
    String kid = envelope.getKid().orElse(null);
    if (signature.length != Ed25519SignatureVerifier.SIGNATURE_LENGTH) {
      return Verification.failure(contentId, kid, FailureReason.INVALID_SIGNATURE_FORMAT,
          String.format("raw signature is %d bytes", signature.length));
    }

    KeySetResolution resolution = resolver.resolve(
        options.getKeySet(), envelope.getInlineKeySet(), envelope.getKeySetUrl());
    if (resolution.getStatus() == KeySetResolution.Status.FETCH_FAILED) {
      return Verification.failure(contentId, kid, FailureReason.KEY_SET_FETCH_FAILED,
          resolution.getDetail().orElse(null));
    }
    Optional<KeySet> keySet = resolution.getKeySet();
    if (keySet.isEmpty()) {
      return Verification.failure(contentId, kid, FailureReason.NO_KEY_SET);
    }

    Optional<Jwk> key = KeySetResolver.selectKey(keySet.get(), kid);
    if (key.isEmpty()) {
      return Verification.failure(contentId, kid, FailureReason.KID_NOT_FOUND);
    }
    Result<byte[], String> publicKey = key.get().decodePublicKey();
    if (publicKey.isError()) {
      return Verification.failure(
          contentId, kid, FailureReason.INVALID_KEY, publicKey.error().get());
    }
    if (!Ed25519SignatureVerifier.verify(publicKey.success().get(), content, signature)) {
      return Verification.failure(contentId, kid, FailureReason.SIGNATURE_INVALID, labelMismatch);
    }
    return Verification.success(contentId, kid);
  }

  private static BigInteger nanos(Instant instant) {
    return BigInteger.valueOf(instant.getEpochSecond())
        .multiply(NANOS_PER_SECOND)
        .add(BigInteger.valueOf(instant.getNano()));
  }

  private static BigInteger nanos(Duration duration) {
    return BigInteger.valueOf(duration.getSeconds())
        .multiply(NANOS_PER_SECOND)
        .add(BigInteger.valueOf(duration.getNano()));
  }
}
