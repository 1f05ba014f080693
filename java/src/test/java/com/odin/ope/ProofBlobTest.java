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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import com.odin.util.Base64Url;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProofBlobTest {
  @Test
  public void testStructuredProofIsRecognized() throws Exception {
    StructuredProof proof = OpeSigner.generate("gw-1", Clock.systemUTC())
                                .sign("hello".getBytes(StandardCharsets.UTF_8), null);

    ProofBlob blob = ProofBlob.decode(proof.encode());

    assertEquals(ProofBlob.Kind.STRUCTURED, blob.getKind());
    assertEquals("gw-1", blob.getStructuredProof().getKid());
    assertThrows(IllegalStateException.class, blob::getRawSignature);
  }

  @Test
  public void testSignatureBytesAreRaw() {
    byte[] signature = new byte[64];
    signature[0] = '{';

    ProofBlob blob = ProofBlob.decode(Base64Url.encode(signature));

    assertEquals(ProofBlob.Kind.RAW, blob.getKind());
    assertArrayEquals(signature, blob.getRawSignature());
    assertThrows(IllegalStateException.class, blob::getStructuredProof);
  }

  @Test
  public void testJsonThatIsNotAProofIsRaw() {
    byte[] json = "{\"v\":1}".getBytes(StandardCharsets.UTF_8);
    ProofBlob blob = ProofBlob.decode(Base64Url.encode(json));

    assertEquals(ProofBlob.Kind.RAW, blob.getKind());
    assertEquals(json.length, blob.getRawSignature().length);
  }

  @Test
  public void testUndecodableOrMissingBlobIsEmptyRaw() {
    assertEquals(0, ProofBlob.decode("%%%").getRawSignature().length);
    assertEquals(0, ProofBlob.decode(null).getRawSignature().length);
  }
}
