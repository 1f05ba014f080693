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

package com.odin.cid;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Bytes;
import com.odin.util.Base64Url;
import java.util.Objects;
import org.bouncycastle.crypto.digests.Blake3Digest;

/**
 * Computes ODIN content identifiers.
 *
 * <p>A CID is the multibase ({@code b}, base32 lowercase without padding) encoding of a multihash
 * whose two-byte header names BLAKE3 and the digest length, followed by the 32-byte BLAKE3 digest
 * of the raw content bytes.
 */
public final class ContentAddresser {
  /** Multihash function code emitted by ODIN producers for BLAKE3-256. */
  public static final byte MULTIHASH_BLAKE3 = 0x1f;

  public static final int DIGEST_LENGTH = 32;

  /** Multibase tag for RFC 4648 base32, lowercase, unpadded. */
  public static final String MULTIBASE_BASE32 = "b";

  private static final BaseEncoding BASE32_LOWER = BaseEncoding.base32().lowerCase().omitPadding();

  /**
   * Computes the content identifier of {@code content}.
   *
   * @param content the exact bytes to address
   * @return the multibase-encoded multihash, e.g. {@code bd4q...}
   */
  public static String computeContentId(byte[] content) {
    byte[] header = new byte[] {MULTIHASH_BLAKE3, (byte) DIGEST_LENGTH};
    return MULTIBASE_BASE32 + BASE32_LOWER.encode(Bytes.concat(header, blake3(content)));
  }

  /** Returns the 32-byte BLAKE3 digest of {@code content}. */
  public static byte[] blake3(byte[] content) {
    Objects.requireNonNull(content, "content");
    Blake3Digest digest = new Blake3Digest();
    digest.update(content, 0, content.length);
    byte[] out = new byte[DIGEST_LENGTH];
    digest.doFinal(out, 0);
    return out;
  }

  /** Returns the unpadded base64url form of the BLAKE3 digest, as carried in structured proofs. */
  public static String blake3Base64Url(byte[] content) {
    return Base64Url.encode(blake3(content));
  }

  private ContentAddresser() {}
}
