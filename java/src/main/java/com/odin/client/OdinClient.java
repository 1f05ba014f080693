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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.odin.envelope.EnvelopeVerifier;
import com.odin.envelope.FailureReason;
import com.odin.envelope.ProofEnvelope;
import com.odin.envelope.Verification;
import com.odin.transport.TransportResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client for ODIN gateway endpoints that answer with {@code {payload, proof}}. Every response proof
 * is verified before the payload is handed out.
 */
public class OdinClient {
  private static final Logger logger = Logger.getLogger(OdinClient.class.getName());

  public static final String ACCEPT_PROOF_HEADER = "X-ODIN-Accept-Proof";

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  private final URI base;
  private final ClientOptions options;
  private final EnvelopeVerifier verifier;
  private final Discovery discovery;

  public OdinClient(String baseUrl, ClientOptions options) {
    this(baseUrl, options, null);
  }

  private OdinClient(String baseUrl, ClientOptions options, Discovery discovery) {
    this.base = URI.create(DiscoveryClient.stripTrailingSlashes(baseUrl) + "/");
    this.options = Objects.requireNonNull(options, "options");
    this.verifier = new EnvelopeVerifier(options.getKeySetFetcher());
    this.discovery = discovery;
  }

  /**
   * Creates a client after fetching and validating the gateway's discovery document.
   *
   * @throws IOException if discovery fails
   */
  public static OdinClient fromDiscovery(String baseUrl, ClientOptions options)
      throws IOException {
    Discovery discovery =
        new DiscoveryClient(options.getTransport(), options.getTimeout()).fetch(baseUrl);
    logger.log(Level.INFO, "connected to ODIN gateway {0}", baseUrl);
    return new OdinClient(baseUrl, options, discovery);
  }

  /** The discovery document, if this client was created with {@link #fromDiscovery}. */
  public Optional<Discovery> getDiscovery() {
    return Optional.ofNullable(discovery);
  }

  public EnvelopeResponse postEnvelope(String route, Object body)
      throws IOException, ProofVerificationException {
    return postEnvelope(route, body, Collections.emptyMap());
  }

  /**
   * POSTs {@code body} as JSON and verifies the proof in the response.
   *
   * @param route absolute URL, or a path relative to the base URL
   * @param body request body; {@link JsonElement}s are sent as-is, other objects through Gson
   * @param headers extra request headers; a caller-supplied {@code X-ODIN-Accept-Proof} wins
   * @throws IOException on transport failure, a non-2xx status, or a body that is not JSON
   * @throws ProofVerificationException if proofs are required and the proof is missing or invalid
   */
  public EnvelopeResponse postEnvelope(String route, Object body, Map<String, String> headers)
      throws IOException, ProofVerificationException {
    URI uri = resolve(route);
    Map<String, String> requestHeaders = new LinkedHashMap<>(headers);
    if (!hasHeader(requestHeaders, "Content-Type")) {
      requestHeaders.put("Content-Type", "application/json");
    }
    if (!options.getAcceptProof().isEmpty() && !hasHeader(requestHeaders, ACCEPT_PROOF_HEADER)) {
      requestHeaders.put(ACCEPT_PROOF_HEADER, options.getAcceptProof());
    }
    byte[] requestBody = (body instanceof JsonElement ? GSON.toJson((JsonElement) body)
                                                      : GSON.toJson(body))
                             .getBytes(StandardCharsets.UTF_8);

    TransportResponse response =
        options.getTransport().post(uri, requestHeaders, requestBody, options.getTimeout());
    if (!response.isSuccess()) {
      throw new IOException(String.format("HTTP %d from %s", response.getStatusCode(), uri));
    }
    JsonElement data;
    try {
      data = JsonParser.parseString(response.getBodyAsString());
    } catch (JsonParseException e) {
      throw new IOException("response from " + uri + " is not JSON", e);
    }

    JsonObject object = data.isJsonObject() ? data.getAsJsonObject() : null;
    JsonElement payload = object != null && object.has("payload") ? object.get("payload") : data;
    JsonElement proof = object == null ? null : object.get("proof");
    if (proof == null || proof.isJsonNull()) {
      if (options.isRequireProof()) {
        throw new ProofVerificationException("response missing 'proof' envelope");
      }
      logger.log(Level.FINE, "response from {0} carries no proof", uri);
      return new EnvelopeResponse(
          payload, Verification.failure(null, null, FailureReason.MISSING_PROOF, "no proof"));
    }

    ProofEnvelope envelope;
    try {
      envelope = ProofEnvelope.fromJson(proof);
    } catch (JsonParseException e) {
      throw new IOException("malformed proof envelope from " + uri, e);
    }
    Verification verification = verifier.verify(envelope, options.getVerifyOptions());
    if (options.isRequireProof() && !verification.isOk()) {
      throw new ProofVerificationException(verification);
    }
    return new EnvelopeResponse(payload, verification);
  }

  private URI resolve(String route) {
    String lower = route.toLowerCase();
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      return URI.create(route);
    }
    int start = 0;
    while (start < route.length() && route.charAt(start) == '/') {
      start++;
    }
    return base.resolve(route.substring(start));
  }

  private static boolean hasHeader(Map<String, String> headers, String name) {
    for (String key : headers.keySet()) {
      if (key.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }
}
