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

package com.google.iamauth.mapper.index;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.arn.PrincipalArn;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.model.MappingKind;
import java.util.List;

/** A mapping rule held by a {@link MappingIndex}, tagged with its kind and origin. */
@AutoValue
public abstract class ResolvedMapping {

  public static Builder builder() {
    return new AutoValue_ResolvedMapping.Builder()
        .setGroups(ImmutableList.of())
        .setAutoMapped(false);
  }

  /** The configured ARN, or the canonical caller ARN for auto-mapped accounts. */
  public abstract String arn();

  /** {@link #arn()} parsed. */
  public abstract PrincipalArn pattern();

  public abstract MappingKind kind();

  /** Username pattern. Literal for auto-mapped accounts. */
  public abstract String username();

  /** Group patterns. Empty for auto-mapped accounts. */
  public abstract ImmutableList<String> groups();

  /** The backend that contributed this rule. */
  public abstract BackendMode backend();

  /** Whether the rule was synthesized for an auto-mapped account and must not be expanded. */
  public abstract boolean autoMapped();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setArn(String arn);

    public abstract Builder setPattern(PrincipalArn pattern);

    public abstract Builder setKind(MappingKind kind);

    public abstract Builder setUsername(String username);

    public abstract Builder setGroups(List<String> groups);

    public abstract Builder setBackend(BackendMode backend);

    public abstract Builder setAutoMapped(boolean autoMapped);

    public abstract ResolvedMapping build();
  }
}
