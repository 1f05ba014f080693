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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContentAddresserTest {
  // BLAKE3 of the empty input.
  private static final String EMPTY_DIGEST_HEX =
      "af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262";
  private static final String EMPTY_CID = "bd4qk6e2jxh27tingubae32rw3teutg6lexe23qisw7gjve6k4qpteyq";

  @Test
  public void testBlake3KnownVector() {
    assertArrayEquals(
        BaseEncoding.base16().lowerCase().decode(EMPTY_DIGEST_HEX),
        ContentAddresser.blake3(new byte[0]));
  }

  @Test
  public void testContentIdKnownVector() {
    assertEquals(EMPTY_CID, ContentAddresser.computeContentId(new byte[0]));
  }

  @Test
  public void testContentIdShape() {
    Random random = new Random(7);
    for (int size : new int[] {1, 31, 64, 1025, 70000}) {
      byte[] content = new byte[size];
      random.nextBytes(content);
      String cid = ContentAddresser.computeContentId(content);
      assertEquals(56, cid.length());
      assertTrue(cid, cid.startsWith("bd4q"));
      assertTrue(cid, cid.matches("b[a-z2-7]+"));
    }
  }

  @Test
  public void testContentIdIsDeterministic() {
    byte[] content = "{\"x\":1}\n".getBytes(StandardCharsets.UTF_8);
    assertEquals(
        ContentAddresser.computeContentId(content),
        ContentAddresser.computeContentId(content.clone()));
  }

  @Test
  public void testContentIdDependsOnEveryByte() {
    byte[] content = "{\"x\":1}\n".getBytes(StandardCharsets.UTF_8);
    String original = ContentAddresser.computeContentId(content);
    for (int i = 0; i < content.length; i++) {
      byte[] modified = content.clone();
      modified[i] ^= 0x01;
      assertNotEquals(original, ContentAddresser.computeContentId(modified));
    }
  }

  @Test
  public void testBlake3Base64UrlIsUnpadded() {
    String hash = ContentAddresser.blake3Base64Url(new byte[0]);
    assertEquals(43, hash.length());
    assertEquals("rxNJufX5oaagQE3qNtzJSZvLJcmtwRK3zJqTyuQfMmI", hash);
  }
}
