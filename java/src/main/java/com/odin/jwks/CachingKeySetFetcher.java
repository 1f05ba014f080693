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

package com.odin.jwks;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caches the last key set fetched from each URL.
 *
 * <p>When a refresh returns a different key set, the previous one is retained for a grace window:
 * its keys whose kid does not appear in the fresh set are served after the fresh keys, so
 * envelopes signed just before a rotation still verify.
 *
 * <p>At most {@link #DEFAULT_MAXIMUM_SIZE} URLs are remembered. A URL that is not fetched again
 * within the TTL plus the rotation grace is forgotten, previous keys included.
 */
public final class CachingKeySetFetcher implements KeySetFetcher {
  private static final Logger logger = Logger.getLogger(CachingKeySetFetcher.class.getName());

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
  public static final Duration DEFAULT_ROTATION_GRACE = Duration.ofSeconds(600);
  public static final long DEFAULT_MAXIMUM_SIZE = 1_000;

  static final String TTL_ENV = "JWKS_CACHE_TTL";
  static final String ROTATION_GRACE_ENV = "ROTATION_GRACE_SEC";

  private static final class Entry {
    final KeySet current;
    final Instant fetchedAt;
    final KeySet previous;
    final Instant previousUntil;

    Entry(KeySet current, Instant fetchedAt, KeySet previous, Instant previousUntil) {
      this.current = current;
      this.fetchedAt = fetchedAt;
      this.previous = previous;
      this.previousUntil = previousUntil;
    }
  }

  private final KeySetFetcher delegate;
  private final Clock clock;
  private final Duration ttl;
  private final Duration rotationGrace;
  private final Cache<URI, Entry> cache;

  public CachingKeySetFetcher(KeySetFetcher delegate, Clock clock) {
    this(delegate, clock, DEFAULT_TTL, DEFAULT_ROTATION_GRACE);
  }

  public CachingKeySetFetcher(
      KeySetFetcher delegate, Clock clock, Duration ttl, Duration rotationGrace) {
    this(delegate, clock, ttl, rotationGrace, DEFAULT_MAXIMUM_SIZE);
  }

  CachingKeySetFetcher(KeySetFetcher delegate, Clock clock, Duration ttl, Duration rotationGrace,
      long maximumSize) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.clock = Objects.requireNonNull(clock, "clock");
    Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    Preconditions.checkArgument(!rotationGrace.isNegative(), "rotation grace must not be negative");
    Preconditions.checkArgument(maximumSize > 0, "maximum size must be positive");
    this.ttl = ttl;
    this.rotationGrace = rotationGrace;
    this.cache = Caffeine.newBuilder()
                     .maximumSize(maximumSize)
                     .expireAfterWrite(ttl.plus(rotationGrace))
                     .ticker(() -> nanos(clock.instant()))
                     .executor(Runnable::run)
                     .removalListener((URI uri, Entry entry, RemovalCause cause)
                         -> logger.log(Level.FINE, "dropped key set of {0} ({1})",
                             new Object[] {uri, cause}))
                     .build();
  }

  /**
   * Creates a caching fetcher whose windows are read from {@code JWKS_CACHE_TTL} and {@code
   * ROTATION_GRACE_SEC} (seconds), falling back to the defaults.
   *
   * @throws IllegalArgumentException if a variable is set but not a valid number of seconds
   */
  public static CachingKeySetFetcher fromEnvironment(
      KeySetFetcher delegate, Clock clock, Map<String, String> env) {
    return new CachingKeySetFetcher(delegate, clock,
        seconds(env, TTL_ENV, DEFAULT_TTL), seconds(env, ROTATION_GRACE_ENV, DEFAULT_ROTATION_GRACE));
  }

  @Override
  public Optional<KeySet> fetch(URI uri) throws IOException {
    Instant now = clock.instant();
    Entry entry = cache.getIfPresent(uri);
    if (entry != null && now.isBefore(entry.fetchedAt.plus(ttl))) {
      return Optional.of(view(entry, now));
    }
    Optional<KeySet> fresh = delegate.fetch(uri);
    if (fresh.isEmpty()) {
      return fresh;
    }
    Entry updated;
    if (entry == null) {
      updated = new Entry(fresh.get(), now, null, null);
    } else if (entry.current.equals(fresh.get())) {
      updated = new Entry(fresh.get(), now, entry.previous, entry.previousUntil);
    } else {
      logger.log(Level.INFO, "key set at {0} rotated, keeping previous keys for {1}",
          new Object[] {uri, rotationGrace});
      updated = new Entry(fresh.get(), now, entry.current, now.plus(rotationGrace));
    }
    cache.put(uri, updated);
    return Optional.of(view(updated, now));
  }

  /** Drops every cached key set. */
  public void invalidateAll() {
    cache.invalidateAll();
  }

  /** Number of URLs currently cached. */
  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static long nanos(Instant instant) {
    return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
  }

  private static KeySet view(Entry entry, Instant now) {
    if (entry.previous == null || !now.isBefore(entry.previousUntil)) {
      return entry.current;
    }
    Set<String> freshKids = new HashSet<>();
    for (Jwk key : entry.current.getKeys()) {
      key.getKid().map(String::trim).ifPresent(freshKids::add);
    }
    ImmutableList.Builder<Jwk> merged = ImmutableList.<Jwk>builder().addAll(entry.current.getKeys());
    for (Jwk key : entry.previous.getKeys()) {
      if (key.getKid().map(String::trim).filter(kid -> !freshKids.contains(kid)).isPresent()) {
        merged.add(key);
      }
    }
    return KeySet.of(merged.build());
  }

  private static Duration seconds(Map<String, String> env, String name, Duration fallback) {
    String value = env.get(name);
    if (value == null || value.trim().isEmpty()) {
      return fallback;
    }
    try {
      return Duration.ofSeconds(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be a number of seconds, got '%s'", name, value), e);
    }
  }
}
