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

package com.odin.envelope;

import com.google.common.base.MoreObjects;
import com.google.gson.JsonObject;
import java.util.Objects;
import java.util.Optional;

/** The outcome of verifying one envelope. */
public final class Verification {
  private final boolean ok;
  private final String contentId;
  private final String kid;
  private final FailureReason reason;
  private final String detail;

  private Verification(
      boolean ok, String contentId, String kid, FailureReason reason, String detail) {
    this.ok = ok;
    this.contentId = contentId;
    this.kid = kid;
    this.reason = reason;
    this.detail = detail;
  }

  public static Verification success(String contentId, String kid) {
    return new Verification(true, Objects.requireNonNull(contentId, "contentId"), kid, null, null);
  }

  public static Verification failure(String contentId, String kid, FailureReason reason) {
    return failure(contentId, kid, reason, null);
  }

  public static Verification failure(
      String contentId, String kid, FailureReason reason, String detail) {
    return new Verification(
        false, contentId, kid, Objects.requireNonNull(reason, "reason"), detail);
  }

  public boolean isOk() {
    return ok;
  }

  /** The content identifier computed from the content bytes; empty only if they were missing. */
  public Optional<String> getContentId() {
    return Optional.ofNullable(contentId);
  }

  public Optional<String> getKid() {
    return Optional.ofNullable(kid);
  }

  /** Present exactly when {@link #isOk()} is false. */
  public Optional<FailureReason> getFailureReason() {
    return Optional.ofNullable(reason);
  }

  /** Free-text diagnostic; never used for decisions. */
  public Optional<String> getDetail() {
    return Optional.ofNullable(detail);
  }

  /** Wire form: {@code {ok, cid, kid, reason?, detail?}}. */
  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("ok", ok);
    json.addProperty("cid", contentId);
    json.addProperty("kid", kid);
    if (reason != null) {
      json.addProperty("reason", reason.getCode());
    }
    if (detail != null) {
      json.addProperty("detail", detail);
    }
    return json;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Verification)) {
      return false;
    }
    Verification that = (Verification) o;
    return ok == that.ok && Objects.equals(contentId, that.contentId)
        && Objects.equals(kid, that.kid) && reason == that.reason
        && Objects.equals(detail, that.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ok, contentId, kid, reason, detail);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("ok", ok)
        .add("cid", contentId)
        .add("kid", kid)
        .add("reason", reason)
        .add("detail", detail)
        .toString();
  }
}
