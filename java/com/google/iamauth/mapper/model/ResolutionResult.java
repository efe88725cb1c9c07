/*
 * Copyright 2022 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.iamauth.mapper.model;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Outcome of resolving a caller ARN, with the identity when it was allowed. */
@AutoValue
public abstract class ResolutionResult {

  /** Possible outcomes of a resolution. Anything but {@link #ALLOWED} is unauthenticated. */
  public enum Outcome {
    ALLOWED,
    // No mapping and no auto-mapped account matched the caller.
    DENIED,
    // The caller ARN could not be parsed, or the matched mapping could not be expanded.
    MALFORMED,
  }

  public static ResolutionResult allowed(PlatformIdentity identity, String matchedArn) {
    return new AutoValue_ResolutionResult(
        Outcome.ALLOWED, Optional.of(identity), Optional.of(matchedArn), Optional.empty());
  }

  public static ResolutionResult denied(String detail) {
    return new AutoValue_ResolutionResult(
        Outcome.DENIED, Optional.empty(), Optional.empty(), Optional.of(detail));
  }

  public static ResolutionResult malformed(String detail) {
    return new AutoValue_ResolutionResult(
        Outcome.MALFORMED, Optional.empty(), Optional.empty(), Optional.of(detail));
  }

  public static ResolutionResult malformed(String matchedArn, String detail) {
    return new AutoValue_ResolutionResult(
        Outcome.MALFORMED, Optional.empty(), Optional.of(matchedArn), Optional.of(detail));
  }

  public abstract Outcome outcome();

  public abstract Optional<PlatformIdentity> identity();

  /** ARN of the mapping that matched, or the caller ARN for auto-mapped accounts. */
  public abstract Optional<String> matchedArn();

  /** Diagnostic message for unsuccessful outcomes. */
  public abstract Optional<String> detail();

  public boolean isAllowed() {
    return outcome() == Outcome.ALLOWED;
  }
}
