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

package com.odin.util;

import java.util.Base64;

/**
 * Base64url helpers used for every binary field on the wire.
 *
 * <p>Encoding always uses the URL alphabet without padding. Decoding is forgiving: padding is
 * optional, the standard alphabet ({@code +} and {@code /}) is accepted and surrounding whitespace
 * is ignored.
 */
public final class Base64Url {
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  public static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes a base64url (or standard base64) string.
   *
   * @throws IllegalArgumentException if {@code value} is not valid base64
   */
  public static byte[] decode(String value) {
    String normalized = value.trim().replace('+', '-').replace('/', '_');
    int end = normalized.length();
    while (end > 0 && normalized.charAt(end - 1) == '=') {
      end--;
    }
    return DECODER.decode(normalized.substring(0, end));
  }

  /** Same as {@link #decode(String)}, but reports malformed input as an error value. */
  public static Result<byte[], String> tryDecode(String value) {
    if (value == null) {
      return Result.error("missing base64url value");
    }
    try {
      return Result.success(decode(value));
    } catch (IllegalArgumentException e) {
      return Result.error("invalid base64url: " + e.getMessage());
    }
  }

  private Base64Url() {}
}
