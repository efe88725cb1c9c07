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

package com.google.iamauth.mapper.arn;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Fields extracted from a caller ARN that matched a configured pattern. */
@AutoValue
public abstract class MatchFields {

  public static Builder builder() {
    return new AutoValue_MatchFields.Builder().setSessionName(Optional.empty());
  }

  public abstract String partition();

  public abstract String accountId();

  /** {@code role} or {@code user}. */
  public abstract String resourceType();

  /** Role or user name. */
  public abstract String resourceId();

  /** IAM path of the caller ARN. */
  public abstract String path();

  public abstract Optional<String> sessionName();

  /** Whether the pattern and the caller also agreed on the IAM path. */
  public abstract boolean exactPath();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setPartition(String partition);

    public abstract Builder setAccountId(String accountId);

    public abstract Builder setResourceType(String resourceType);

    public abstract Builder setResourceId(String resourceId);

    public abstract Builder setPath(String path);

    public abstract Builder setSessionName(Optional<String> sessionName);

    public abstract Builder setExactPath(boolean exactPath);

    public abstract MatchFields build();
  }
}
