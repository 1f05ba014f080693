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


package com.odin.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.odin.cid.Canonicalizer;
import com.odin.cid.ContentAddresser;
import com.odin.envelope.FailureReason;
import com.odin.envelope.ProofEnvelope;
import com.odin.envelope.VerifyOptions;
import com.odin.jwks.KeySet;
import com.odin.ope.OpeSigner;
import com.odin.testing.FakeHttpTransport;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OdinClientTest {
  private static final String BASE = "https://gw.example/";
  private static final String ROUTE_URL = "https://gw.example/v1/translate";
  private static final String JWKS_URL = "https://gw.example/.well-known/jwks.json";

  private static class Translation {
    String text;
  }

  private final FakeHttpTransport transport = new FakeHttpTransport();
  private OpeSigner signer;
  private JsonObject payload;
  private byte[] content;

  @Before
  public void setUp() throws Exception {
    signer = OpeSigner.generate("gw-1", Clock.systemUTC());
    payload = JsonParser.parseString("{\"text\":\"hola\"}").getAsJsonObject();
    content = Canonicalizer.canonicalize(payload);
  }

  private OdinClient client(boolean requireProof) {
    return new OdinClient(BASE,
        ClientOptions.newBuilder().setTransport(transport).setRequireProof(requireProof).build());
  }

  private String response(ProofEnvelope envelope) {
    JsonObject body = new JsonObject();
    body.add("payload", payload);
    body.add("proof", envelope.toJson());
    return body.toString();
  }

  private ProofEnvelope signedEnvelope() throws Exception {
    return ProofEnvelope.forStructuredProof(
        content, signer.sign(content, ContentAddresser.computeContentId(content)));
  }

  @Test
  public void testReturnsVerifiedPayload() throws Exception {
    transport.respond(ROUTE_URL, 200, response(signedEnvelope()));

    EnvelopeResponse response =
        client(true).postEnvelope("/v1/translate", ImmutableMap.of("text", "hello"));

    assertTrue(response.getVerification().isOk());
    assertEquals("hola", response.getPayload(Translation.class).text);
    assertEquals(payload, response.getPayload());

    FakeHttpTransport.Request request = transport.lastRequest();
    assertEquals("POST", request.method);
    assertEquals("{\"text\":\"hello\"}", request.body);
    assertEquals("embed,headers", request.headers.get(OdinClient.ACCEPT_PROOF_HEADER));
    assertEquals("application/json", request.headers.get("Content-Type"));
  }

  @Test
  public void testCallerAcceptProofHeaderWins() throws Exception {
    transport.respond(ROUTE_URL, 200, response(signedEnvelope()));

    client(true).postEnvelope(
        "v1/translate", new JsonObject(), ImmutableMap.of("x-odin-accept-proof", "headers"));

    FakeHttpTransport.Request request = transport.lastRequest();
    assertEquals("headers", request.headers.get("x-odin-accept-proof"));
    assertFalse(request.headers.containsKey(OdinClient.ACCEPT_PROOF_HEADER));
  }

  @Test
  public void testAbsoluteRouteIsUsedAsIs() throws Exception {
    transport.respond("https://other.example/run", 200, response(signedEnvelope()));

    assertTrue(client(true)
                   .postEnvelope("https://other.example/run", new JsonObject())
                   .getVerification()
                   .isOk());
  }

  @Test
  public void testMissingProofThrowsWhenRequired() {
    transport.respond(ROUTE_URL, 200, "{\"payload\":{\"text\":\"hola\"}}");

    ProofVerificationException e = assertThrows(ProofVerificationException.class,
        () -> client(true).postEnvelope("/v1/translate", new JsonObject()));
    assertEquals("response missing 'proof' envelope", e.getMessage());
    assertFalse(e.getFailureReason().isPresent());
  }

  @Test
  public void testMissingProofIsReportedWhenOptional() throws Exception {
    transport.respond(ROUTE_URL, 200, "{\"text\":\"hola\"}");

    EnvelopeResponse response = client(false).postEnvelope("/v1/translate", new JsonObject());

    assertFalse(response.getVerification().isOk());
    assertEquals(Optional.of(FailureReason.MISSING_PROOF),
        response.getVerification().getFailureReason());
    assertEquals(Optional.of("no proof"), response.getVerification().getDetail());
    assertEquals(payload, response.getPayload());
  }

  @Test
  public void testInvalidProofThrowsWhenRequired() throws Exception {
    ProofEnvelope tampered =
        signedEnvelope().toBuilder().setContent(new byte[] {'{', '}', '\n'}).build();
    transport.respond(ROUTE_URL, 200, response(tampered));

    ProofVerificationException e = assertThrows(ProofVerificationException.class,
        () -> client(true).postEnvelope("/v1/translate", new JsonObject()));
    assertEquals(Optional.of(FailureReason.VERIFY_FAILED), e.getFailureReason());
    assertEquals("ODIN proof verification failed: verify_failed", e.getMessage());
  }

  @Test
  public void testInvalidProofIsReturnedWhenOptional() throws Exception {
    ProofEnvelope tampered =
        signedEnvelope().toBuilder().setContent(new byte[] {'{', '}', '\n'}).build();
    transport.respond(ROUTE_URL, 200, response(tampered));

    EnvelopeResponse response = client(false).postEnvelope("/v1/translate", new JsonObject());

    assertEquals(Optional.of(FailureReason.VERIFY_FAILED),
        response.getVerification().getFailureReason());
  }

  @Test
  public void testKeySetNamedByEnvelopeIsFetchedOverTransport() throws Exception {
    ProofEnvelope envelope = signedEnvelope().toBuilder().setKeySetUrl(JWKS_URL).build();
    transport.respond(ROUTE_URL, 200, response(envelope));
    transport.respond(JWKS_URL, 200, KeySet.of(signer.toJwk()).toJson().toString());

    assertTrue(client(true).postEnvelope("/v1/translate", new JsonObject())
                   .getVerification()
                   .isOk());
    assertEquals(JWKS_URL, transport.lastRequest().uri.toString());
  }

  @Test
  public void testVerifyOptionsArePassedThrough() throws Exception {
    transport.respond(ROUTE_URL, 200, response(signedEnvelope()));
    OdinClient strict = new OdinClient(BASE, ClientOptions.newBuilder()
        .setTransport(transport)
        .setVerifyOptions(VerifyOptions.newBuilder().setRequireKeySet(true).build())
        .build());

    ProofVerificationException e = assertThrows(ProofVerificationException.class,
        () -> strict.postEnvelope("/v1/translate", new JsonObject()));
    assertEquals(Optional.of(FailureReason.NO_KEY_SET), e.getFailureReason());
  }

  @Test
  public void testHttpErrorsAreIoExceptions() {
    transport.respond(ROUTE_URL, 500, "{}");
    assertThrows(IOException.class,
        () -> client(false).postEnvelope("/v1/translate", new JsonObject()));

    transport.respond(ROUTE_URL, 200, "<html>not json");
    assertThrows(IOException.class,
        () -> client(false).postEnvelope("/v1/translate", new JsonObject()));
  }

  @Test
  public void testFromDiscoveryKeepsDocument() throws Exception {
    transport.respond("https://gw.example/.well-known/odin/discovery.json", 200,
        "{\"jwks_url\":\"" + JWKS_URL + "\"}");

    OdinClient client = OdinClient.fromDiscovery(
        "https://gw.example//", ClientOptions.newBuilder().setTransport(transport).build());

    assertEquals(JWKS_URL, client.getDiscovery().get().getKeySetUrl());
    assertFalse(client(true).getDiscovery().isPresent());
  }
}
