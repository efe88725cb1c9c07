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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** The Kubernetes identity a caller resolved to. */
@AutoValue
public abstract class PlatformIdentity {

  public static Builder builder() {
    return new AutoValue_PlatformIdentity.Builder().setGroups(ImmutableList.of());
  }

  public abstract String username();

  public abstract ImmutableList<String> groups();

  /** Canonical IAM ARN of the caller, assumed-role ARNs rewritten to their role ARN. */
  public abstract String arn();

  public abstract String accountId();

  public abstract Optional<String> sessionName();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setUsername(String username);

    public abstract Builder setGroups(List<String> groups);

    public abstract Builder setArn(String arn);

    public abstract Builder setAccountId(String accountId);

    public abstract Builder setSessionName(Optional<String> sessionName);

    public abstract PlatformIdentity build();
  }
}
