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

/** The kind of IAM principal a mapping applies to. */
public enum MappingKind {
  /** An IAM role, possibly assumed through STS with a session name. */
  ROLE("role"),
  /** An IAM user. Users have no session. */
  USER("user");

  private final String resourceType;

  MappingKind(String resourceType) {
    this.resourceType = resourceType;
  }

  /** Returns the ARN resource type prefix, e.g. {@code role} in {@code role/Foo}. */
  public String getResourceType() {
    return resourceType;
  }

  /** Whether {@code {{SessionName}}} can be resolved for principals of this kind. */
  public boolean hasSession() {
    return this == ROLE;
  }
}
