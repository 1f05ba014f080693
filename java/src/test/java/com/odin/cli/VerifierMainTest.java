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


package com.odin.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.odin.cid.ContentAddresser;
import com.odin.envelope.ProofEnvelope;
import com.odin.jwks.KeySet;
import com.odin.jwks.KeySetFetcher;
import com.odin.jwks.KeySetLoader;
import com.odin.ope.OpeSigner;
import com.odin.testing.FakeHttpTransport;
import com.odin.testing.MutableClock;
import com.odin.util.Base64Url;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class VerifierMainTest {
  private static final byte[] CONTENT = "{\"x\":1}\n".getBytes(StandardCharsets.UTF_8);

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private OpeSigner signer;
  private OpeSigner impostor;
  private ProofEnvelope envelope;

  @Before
  public void setUp() throws Exception {
    signer = OpeSigner.generate("gw-1", Clock.systemUTC());
    impostor = OpeSigner.generate("gw-1", Clock.systemUTC());
    envelope = ProofEnvelope.forStructuredProof(
        CONTENT, signer.sign(CONTENT, ContentAddresser.computeContentId(CONTENT)));
  }

  private int run(Map<String, String> env, String stdin, String... args) {
    VerifierMain cli = new VerifierMain(KeySetFetcher.disabled(), env);
    return cli.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(out, true), new PrintStream(err, true));
  }

  private int run(String... args) {
    return run(ImmutableMap.of(), "", args);
  }

  private String write(String name, String content) throws IOException {
    File file = temporaryFolder.newFile(name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file.getPath();
  }

  private JsonObject output() {
    return JsonParser.parseString(out.toString(StandardCharsets.UTF_8)).getAsJsonObject();
  }

  @Test
  public void testVerifiesEnvelopeFile() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());

    assertEquals(VerifierMain.EXIT_OK, run("verify", path));

    JsonObject result = output();
    assertTrue(result.get("ok").getAsBoolean());
    assertEquals(ContentAddresser.computeContentId(CONTENT), result.get("cid").getAsString());
    assertEquals("gw-1", result.get("kid").getAsString());
  }

  @Test
  public void testReadsWrappedResponseFromStdin() {
    JsonObject response = new JsonObject();
    response.add("payload", JsonParser.parseString("{\"x\":1}"));
    response.add("proof", envelope.toJson());

    assertEquals(VerifierMain.EXIT_OK, run(ImmutableMap.of(), response.toString(), "verify", "-"));
  }

  @Test
  public void testExpectedCidMismatchFails() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());
    String other = ContentAddresser.computeContentId(new byte[0]);

    assertEquals(VerifierMain.EXIT_FAILED, run("verify", path, "--cid", other));
    assertEquals("cid_mismatch", output().get("reason").getAsString());
  }

  @Test
  public void testInlineKeySetMustHoldSigningKey() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());
    String trusted = KeySet.of(impostor.toJwk()).toJson().toString();

    assertEquals(VerifierMain.EXIT_FAILED, run("verify", path, "--jwks", trusted));
    assertEquals("jwks_pub_mismatch", output().get("reason").getAsString());
  }

  @Test
  public void testKeySetFileIsHonored() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());
    String jwks = write("jwks.json", KeySet.of(signer.toJwk()).toJson().toString());

    assertEquals(VerifierMain.EXIT_OK, run("verify", path, "--jwks", jwks, "--require-key-set"));
  }

  @Test
  public void testRequireKeySetWithoutKeysFails() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());

    assertEquals(VerifierMain.EXIT_FAILED, run("verify", path, "--require-key-set"));
    assertEquals("no_jwks", output().get("reason").getAsString());
  }

  @Test
  public void testEnvironmentKeyIsUsedWithoutJwksFlag() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());
    Map<String, String> env = ImmutableMap.of(
        KeySetLoader.PUBKEY_ENV, Base64Url.encode(impostor.getPublicKey()),
        KeySetLoader.KID_ENV, "gw-1");

    assertEquals(VerifierMain.EXIT_FAILED, run(env, "", "verify", path));
    assertEquals("jwks_pub_mismatch", output().get("reason").getAsString());
  }

  @Test
  public void testKeySetsAreCachedForConfiguredTtl() throws Exception {
    String jwksUrl = "https://gw.example/.well-known/jwks.json";
    FakeHttpTransport transport = new FakeHttpTransport();
    transport.respond(jwksUrl, 200, KeySet.of(signer.toJwk()).toJson().toString());
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    Map<String, String> env = ImmutableMap.of("JWKS_CACHE_TTL", "60");
    VerifierMain cli = new VerifierMain(VerifierMain.keySetFetcher(transport, clock, env), env);
    String path = write("envelope.json",
        envelope.toBuilder().setKeySetUrl(jwksUrl).build().toJson().toString());
    String[] args = {"verify", path, "--require-key-set"};
    ByteArrayInputStream in = new ByteArrayInputStream(new byte[0]);
    PrintStream stdout = new PrintStream(out);
    PrintStream stderr = new PrintStream(err);

    assertEquals(VerifierMain.EXIT_OK, cli.run(args, in, stdout, stderr));
    assertEquals(VerifierMain.EXIT_OK, cli.run(args, in, stdout, stderr));
    assertEquals(1, transport.getRequests().size());

    clock.advance(Duration.ofSeconds(60));
    assertEquals(VerifierMain.EXIT_OK, cli.run(args, in, stdout, stderr));
    assertEquals(2, transport.getRequests().size());
  }

  @Test
  public void testInvalidCacheSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> VerifierMain.keySetFetcher(new FakeHttpTransport(), Clock.systemUTC(),
            ImmutableMap.of("ROTATION_GRACE_SEC", "later")));
  }

  @Test
  public void testUsageErrors() throws Exception {
    String path = write("envelope.json", envelope.toJson().toString());

    assertEquals(VerifierMain.EXIT_USAGE, run());
    assertEquals(VerifierMain.EXIT_USAGE, run("verify"));
    assertEquals(VerifierMain.EXIT_USAGE, run("sign", path));
    assertEquals(VerifierMain.EXIT_USAGE, run("verify", path, "--bogus"));
    assertEquals(VerifierMain.EXIT_USAGE, run("verify", path, "--cid"));
    assertEquals(VerifierMain.EXIT_USAGE, run("verify", path, "--max-skew-seconds", "soon"));
    assertEquals(VerifierMain.EXIT_USAGE, run("cid", path, "extra"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage:"));
  }

  @Test
  public void testInputErrors() throws Exception {
    String missing = new File(temporaryFolder.getRoot(), "missing.json").getPath();
    String notEnvelope = write("array.json", "[1, 2]");

    assertEquals(VerifierMain.EXIT_USAGE, run("verify", missing));
    assertEquals(VerifierMain.EXIT_USAGE, run("verify", notEnvelope));
    assertEquals(VerifierMain.EXIT_USAGE,
        run("verify", notEnvelope, "--jwks", "{\"keys\":[{\"kty\":\"RSA\"}]}"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("error: "));
  }

  @Test
  public void testCidCommands() throws Exception {
    String raw = write("raw.json", "{\"x\":1}\n");
    String loose = write("loose.json", "{ \"x\" : 1 }");

    assertEquals(VerifierMain.EXIT_OK, run("cid", raw));
    assertEquals(VerifierMain.EXIT_OK, run("canonical-cid", loose));

    String expected = ContentAddresser.computeContentId(CONTENT);
    assertEquals(expected + System.lineSeparator() + expected + System.lineSeparator(),
        out.toString(StandardCharsets.UTF_8));
  }

  @Test
  public void testCidReadsStdin() {
    assertEquals(VerifierMain.EXIT_OK, run(ImmutableMap.of(), "", "cid", "-"));
    assertEquals("bd4qk6e2jxh27tingubae32rw3teutg6lexe23qisw7gjve6k4qpteyq",
        out.toString(StandardCharsets.UTF_8).trim());
  }
}
