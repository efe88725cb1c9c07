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

package com.google.iamauth.mapper.template;

import com.google.iamauth.mapper.model.ErrorReason;

/** Thrown when a username or group pattern cannot be expanded. */
public final class UnresolvedTemplateException extends Exception {

  private final ErrorReason reason;
  private final String token;

  public UnresolvedTemplateException(String message, ErrorReason reason, String token) {
    super(message);
    this.reason = reason;
    this.token = token;
  }

  /**
   * Either {@link ErrorReason#UNKNOWN_TEMPLATE_TOKEN} or {@link
   * ErrorReason#SESSION_NAME_NOT_APPLICABLE}.
   */
  public ErrorReason getReason() {
    return reason;
  }

  /** The offending token including its braces. */
  public String getToken() {
    return token;
  }

  @Override
  public String toString() {
    return String.format("%s (Error reason: %s)", super.toString(), reason);
  }
}
