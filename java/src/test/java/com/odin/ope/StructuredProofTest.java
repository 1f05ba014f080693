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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.odin.util.Base64Url;
import com.odin.util.Result;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StructuredProofTest {
  private static final String VALID = "{\"v\":1,\"alg\":\"Ed25519\",\"ts_ns\":1700000000000000000,"
      + "\"kid\":\"gw-1\",\"pub_b64u\":\"AAAA\",\"content_hash_b3_256_b64u\":\"BBBB\","
      + "\"sig_b64u\":\"CCCC\",\"oml_cid\":\"bd4qabc\"}";

  private static Result<StructuredProof, String> parse(String json) {
    return StructuredProof.parse(json.getBytes(StandardCharsets.UTF_8));
  }

  private static String with(String member, String value) {
    JsonObject json = JsonParser.parseString(VALID).getAsJsonObject();
    if (value == null) {
      json.remove(member);
    } else {
      json.add(member, JsonParser.parseString(value));
    }
    return json.toString();
  }

  @Test
  public void testParsesValidProof() {
    StructuredProof proof = parse(VALID).success().get();

    assertEquals(1, proof.getVersion());
    assertEquals("Ed25519", proof.getAlgorithm());
    assertEquals(1_700_000_000_000_000_000L, proof.getTimestampNs());
    assertEquals("gw-1", proof.getKid());
    assertEquals(Optional.of("BBBB"), proof.getContentHash());
    assertEquals(Optional.of("bd4qabc"), proof.getContentId());
  }

  @Test
  public void testOptionalMembersMayBeAbsent() {
    StructuredProof noHash = parse(with("content_hash_b3_256_b64u", null)).success().get();
    StructuredProof noContentId = parse(with("oml_cid", null)).success().get();
    assertFalse(noHash.getContentHash().isPresent());
    assertFalse(noContentId.getContentId().isPresent());
  }

  @Test
  public void testAcceptsFullUnsignedTimestampRange() {
    String max = new BigInteger("18446744073709551615").toString();
    StructuredProof proof = parse(with("ts_ns", max)).success().get();
    assertEquals("18446744073709551615", Long.toUnsignedString(proof.getTimestampNs()));
    assertTrue(parse(with("ts_ns", "0")).isSuccess());
  }

  @Test
  public void testRejectsMalformedShapes() {
    String[] invalid = {
        with("v", null),
        with("v", "\"1\""),
        with("v", "1.5"),
        with("ts_ns", "-1"),
        with("ts_ns", "18446744073709551616"),
        with("ts_ns", "\"123\""),
        with("alg", "\"\""),
        with("kid", null),
        with("kid", "7"),
        with("pub_b64u", "\"\""),
        with("sig_b64u", "null"),
        with("oml_cid", "42"),
        with("content_hash_b3_256_b64u", "{}"),
        "[1,2,3]",
        "\"string\"",
        "{not json",
    };
    for (String json : invalid) {
      assertTrue(json, parse(json).isError());
    }
  }

  @Test(timeout = 5000)
  public void testRejectsHugeExponentsWithoutExpandingThem() {
    String[] invalid = {
        VALID.replace("1700000000000000000", "1e400000000"),
        VALID.replace("1700000000000000000", "-1E+400000000"),
        VALID.replace("1700000000000000000", "1e-400000000"),
        VALID.replace("1700000000000000000", "1e2147483647"),
        VALID.replace("\"v\":1", "\"v\":1e400000000"),
        VALID.replace("\"v\":1", "\"v\":1.00000000000000000000000000001"),
    };
    for (String json : invalid) {
      assertTrue(json, parse(json).isError());
    }
    assertEquals(0, parse(VALID.replace("1700000000000000000", "0e-400000000"))
                        .success().get().getTimestampNs());
  }

  @Test
  public void testAcceptsExponentFormIntegers() {
    StructuredProof proof = parse(VALID.replace("1700000000000000000", "1.7e18")).success().get();
    assertEquals(1_700_000_000_000_000_000L, proof.getTimestampNs());
    assertEquals(1, parse(VALID.replace("\"v\":1", "\"v\":1.0")).success().get().getVersion());
  }

  @Test
  public void testRejectsLenientJson() {
    String[] invalid = {
        VALID.replace("\"kid\"", "kid"),
        VALID.replace("\"gw-1\"", "'gw-1'"),
        VALID.replace("{", "{/* c */"),
        VALID + "x",
        VALID + VALID,
    };
    for (String json : invalid) {
      assertTrue(json, parse(json).isError());
    }
    assertTrue(parse(" " + VALID + "\n").isSuccess());
  }

  @Test
  public void testRejectsNonUtf8() {
    assertTrue(StructuredProof.parse(new byte[] {'{', (byte) 0xff, '}'}).isError());
  }

  @Test
  public void testEncodeRoundTrips() {
    StructuredProof proof = parse(VALID).success().get();
    StructuredProof decoded =
        StructuredProof.parse(Base64Url.decode(proof.encode())).success().get();
    assertEquals(proof.toJson(), decoded.toJson());
  }
}
