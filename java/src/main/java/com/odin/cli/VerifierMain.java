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

import com.google.common.io.ByteStreams;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.odin.cid.Canonicalizer;
import com.odin.cid.ContentAddresser;
import com.odin.envelope.EnvelopeVerifier;
import com.odin.envelope.ProofEnvelope;
import com.odin.envelope.Verification;
import com.odin.envelope.VerifyOptions;
import com.odin.jwks.CachingKeySetFetcher;
import com.odin.jwks.HttpKeySetFetcher;
import com.odin.jwks.KeySet;
import com.odin.jwks.KeySetFetcher;
import com.odin.jwks.KeySetLoader;
import com.odin.transport.HttpTransport;
import com.odin.transport.JdkHttpTransport;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Command-line verifier for proof envelopes.
 *
 * <pre>
 * verify &lt;envelope.json|-&gt; [--cid CID] [--jwks SOURCE] [--require-key-set]
 *        [--max-skew-seconds N]
 * cid &lt;file|-&gt;
 * canonical-cid &lt;file.json|-&gt;
 * </pre>
 *
 * Exit code 0 on success, 1 if verification failed, 2 on usage or input errors.
 */
public final class VerifierMain {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = String.join("\n",
      "usage:",
      "  verify <envelope.json|-> [--cid CID] [--jwks SOURCE] [--require-key-set]"
          + " [--max-skew-seconds N]",
      "  cid <file|->",
      "  canonical-cid <file.json|->");

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  private final KeySetFetcher fetcher;
  private final Map<String, String> env;

  VerifierMain(KeySetFetcher fetcher, Map<String, String> env) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.env = Objects.requireNonNull(env, "env");
  }

  public static void main(String[] args) {
    Map<String, String> env = System.getenv();
    KeySetFetcher fetcher;
    try {
      fetcher = keySetFetcher(JdkHttpTransport.create(), Clock.systemUTC(), env);
    } catch (IllegalArgumentException e) {
      System.err.println("error: " + e.getMessage());
      System.exit(EXIT_USAGE);
      return;
    }
    VerifierMain cli = new VerifierMain(fetcher, env);
    System.exit(cli.run(args, System.in, System.out, System.err));
  }

  /**
   * Fetches key sets over {@code transport}, cached for {@code JWKS_CACHE_TTL} seconds with
   * {@code ROTATION_GRACE_SEC} seconds of grace for rotated keys.
   *
   * @throws IllegalArgumentException if either variable is not a number of seconds
   */
  static KeySetFetcher keySetFetcher(
      HttpTransport transport, Clock clock, Map<String, String> env) {
    return CachingKeySetFetcher.fromEnvironment(new HttpKeySetFetcher(transport), clock, env);
  }

  int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    if (args.length < 2) {
      err.println(USAGE);
      return EXIT_USAGE;
    }
    try {
      switch (args[0]) {
        case "verify":
          return verify(args, in, out, err);
        case "cid":
          requireArgs(args, 2);
          out.println(ContentAddresser.computeContentId(read(args[1], in)));
          return EXIT_OK;
        case "canonical-cid":
          requireArgs(args, 2);
          byte[] canonical =
              Canonicalizer.canonicalizeJson(new String(read(args[1], in), StandardCharsets.UTF_8));
          out.println(ContentAddresser.computeContentId(canonical));
          return EXIT_OK;
        default:
          err.println("unknown command: " + args[0]);
          err.println(USAGE);
          return EXIT_USAGE;
      }
    } catch (UsageException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return EXIT_USAGE;
    } catch (IOException | IllegalArgumentException | JsonParseException e) {
      err.println("error: " + e.getMessage());
      return EXIT_USAGE;
    }
  }

  private int verify(String[] args, InputStream in, PrintStream out, PrintStream err)
      throws IOException, UsageException {
    VerifyOptions.Builder options = VerifyOptions.newBuilder();
    String keySetSource = null;
    for (int i = 2; i < args.length; i++) {
      switch (args[i]) {
        case "--cid":
          options.setExpectedContentId(value(args, ++i));
          break;
        case "--jwks":
          keySetSource = value(args, ++i);
          break;
        case "--require-key-set":
          options.setRequireKeySet(true);
          break;
        case "--max-skew-seconds":
          String seconds = value(args, ++i);
          try {
            options.setMaxSkew(Duration.ofSeconds(Long.parseLong(seconds)));
          } catch (NumberFormatException e) {
            throw new UsageException("--max-skew-seconds needs a number, got " + seconds);
          }
          break;
        default:
          throw new UsageException("unknown option: " + args[i]);
      }
    }

    if (keySetSource != null) {
      options.setKeySet(KeySetLoader.load(keySetSource, fetcher));
    } else {
      KeySet configured = KeySetLoader.fromEnvironment(env);
      if (!configured.isEmpty()) {
        options.setKeySet(configured);
      }
    }

    JsonElement json = JsonParser.parseString(new String(read(args[1], in), StandardCharsets.UTF_8));
    // Accept a whole {payload, proof} response as well as a bare envelope.
    if (json.isJsonObject() && json.getAsJsonObject().has("proof")
        && json.getAsJsonObject().get("proof").isJsonObject()) {
      json = json.getAsJsonObject().get("proof");
    }
    ProofEnvelope envelope = ProofEnvelope.fromJson(json);

    Verification verification = new EnvelopeVerifier(fetcher).verify(envelope, options.build());
    out.println(GSON.toJson(verification.toJson()));
    return verification.isOk() ? EXIT_OK : EXIT_FAILED;
  }

  private static byte[] read(String path, InputStream in) throws IOException {
    return "-".equals(path) ? ByteStreams.toByteArray(in) : Files.readAllBytes(Paths.get(path));
  }

  private static String value(String[] args, int index) throws UsageException {
    if (index >= args.length) {
      throw new UsageException(args[index - 1] + " needs a value");
    }
    return args[index];
  }

  private static void requireArgs(String[] args, int count) throws UsageException {
    if (args.length != count) {
      throw new UsageException(args[0] + " takes exactly " + (count - 1) + " argument");
    }
  }

  private static final class UsageException extends Exception {
    private static final long serialVersionUID = 1L;

    UsageException(String message) {
      super(message);
    }
  }
}
