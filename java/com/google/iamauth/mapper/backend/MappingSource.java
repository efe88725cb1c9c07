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

package com.google.iamauth.mapper.backend;

import com.google.iamauth.mapper.model.ErrorReason;
import com.google.iamauth.mapper.model.MappingSet;

/** A backend that mappings are fetched from. */
public interface MappingSource {

  /** The backend this source serves. */
  BackendMode getBackendMode();

  /**
   * Blocking call returning the current mappings of this backend. The returned set has not been
   * validated yet.
   *
   * @throws MappingSourceException if the backend could not be reached or returned data that could
   *     not be parsed
   */
  MappingSet fetch() throws MappingSourceException;

  /** Represents an exception thrown by a {@code MappingSource}. */
  final class MappingSourceException extends Exception {
    private final ErrorReason reason;

    /** Creates a new instance from a message String and a reason. */
    public MappingSourceException(String message, ErrorReason reason) {
      super(message);
      this.reason = reason;
    }

    /** Constructs a new exception with the specified detail message, reason, and cause. */
    public MappingSourceException(String message, ErrorReason reason, Throwable cause) {
      super(message, cause);
      this.reason = reason;
    }

    /**
     * Returns {@link ErrorReason#BACKEND_UNAVAILABLE} or {@link
     * ErrorReason#MALFORMED_BACKEND_DATA}.
     */
    public ErrorReason getReason() {
      return reason;
    }

    @Override
    public String toString() {
      return String.format("%s (Error reason: %s)", super.toString(), reason);
    }
  }
}
