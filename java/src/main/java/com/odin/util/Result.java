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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a decoding step that either produces a value of type {@code R} or an error of type
 * {@code E}.
 *
 * <p>Exactly one of the two is present. Decoders in this library return a {@code Result} instead of
 * throwing, so that malformed wire data can be turned into a verification failure by the caller.
 */
public final class Result<R, E> {
  private final R value;
  private final E error;

  /**
   * Wraps a success value.
   *
   * @param value nonnull success value
   */
  public static <R, E> Result<R, E> success(final R value) {
    return new Result<>(Objects.requireNonNull(value), null);
  }

  /**
   * Wraps an error value.
   *
   * @param error nonnull error value
   */
  public static <R, E> Result<R, E> error(final E error) {
    return new Result<>(null, Objects.requireNonNull(error));
  }

  public boolean isSuccess() {
    return value != null;
  }

  public boolean isError() {
    return error != null;
  }

  /** Returns the success value, or empty if this is an error. */
  public Optional<R> success() {
    return Optional.ofNullable(value);
  }

  /** Returns the error value, or empty if this is a success. */
  public Optional<E> error() {
    return Optional.ofNullable(error);
  }

  /** Applies {@code function} to the error value, leaving a success untouched. */
  public <T> Result<R, T> mapError(final Function<E, T> function) {
    return isError() ? error(function.apply(error)) : success(value);
  }

  /** Chains a further step that itself may fail. */
  public <T> Result<T, E> andThen(final Function<R, Result<T, E>> function) {
    return isSuccess() ? function.apply(value) : error(error);
  }

  public R orElse(final R fallback) {
    return isSuccess() ? value : fallback;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success(" + value + ")" : "Error(" + error + ")";
  }

  private Result(R value, E error) {
    this.value = value;
    this.error = error;
  }
}
