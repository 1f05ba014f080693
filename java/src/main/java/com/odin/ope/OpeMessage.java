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

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;
import java.nio.charset.StandardCharsets;

/**
 * The message an Origin Proof Envelope signs:
 *
 * <pre>"ODIN:OPE:v1" | ts_ns (8 bytes, big-endian) | content [| content id]</pre>
 */
public final class OpeMessage {
  public static final String PREFIX = "ODIN:OPE:v1";

  private static final byte[] PREFIX_BYTES = PREFIX.getBytes(StandardCharsets.UTF_8);
  private static final byte[] SEPARATOR = {'|'};

  /**
   * Builds the signed message.
   *
   * @param tsNs timestamp in nanoseconds since the epoch, treated as unsigned
   * @param content the exact content bytes
   * @param contentId appended when non-null and non-empty
   */
  public static byte[] build(long tsNs, byte[] content, String contentId) {
    byte[] message =
        Bytes.concat(PREFIX_BYTES, SEPARATOR, Longs.toByteArray(tsNs), SEPARATOR, content);
    if (contentId == null || contentId.isEmpty()) {
      return message;
    }
    return Bytes.concat(message, SEPARATOR, contentId.getBytes(StandardCharsets.UTF_8));
  }

  private OpeMessage() {}
}
