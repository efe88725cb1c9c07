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

package com.google.iamauth.mapper.merge;

import com.google.iamauth.mapper.model.ErrorReason;

/** Thrown when no index could be built and there is no earlier index to keep serving. */
public final class MappingBuildException extends Exception {

  private final ErrorReason reason;
  private final BuildReport report;

  public MappingBuildException(String message, BuildReport report) {
    super(message);
    this.reason = ErrorReason.NO_HEALTHY_BACKEND;
    this.report = report;
  }

  public ErrorReason getReason() {
    return reason;
  }

  /** The failed build, with the health of each backend. */
  public BuildReport getReport() {
    return report;
  }

  @Override
  public String toString() {
    return String.format("%s (Error reason: %s)", super.toString(), reason);
  }
}
