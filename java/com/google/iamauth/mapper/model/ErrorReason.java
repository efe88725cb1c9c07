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

/** Error reasons for the identity mapper. */
public enum ErrorReason {
  // The same role or user ARN appears twice in one source.
  DUPLICATE_ARN,
  // A mapping ARN is not an IAM role or user ARN.
  INVALID_MAPPING_ARN,
  // A username or group pattern uses a template token other than AccountID or SessionName.
  UNKNOWN_TEMPLATE_TOKEN,
  // A user mapping references SessionName, or a role was resolved without a session.
  SESSION_NAME_NOT_APPLICABLE,
  // A backend name that is not one of File, MountedFile, EKSConfigMap, CRD.
  UNKNOWN_BACKEND,
  // No backend configured.
  EMPTY_BACKEND_MODE,
  // Partition is not a known AWS partition.
  UNKNOWN_PARTITION,
  // An auto-mapped or scrubbed account is not a 12 digit account ID.
  INVALID_ACCOUNT_ID,
  // Configuration could not be read or parsed.
  MALFORMED_CONFIG,
  // Backend could not be reached within the deadline, or has no registered source.
  BACKEND_UNAVAILABLE,
  // Backend returned data that could not be parsed.
  MALFORMED_BACKEND_DATA,
  // Every configured backend failed.
  NO_HEALTHY_BACKEND,
}
