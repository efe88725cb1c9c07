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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The role mappings, user mappings and auto-mapped accounts contributed by one backend. */
@AutoValue
@JsonDeserialize(builder = MappingSet.Builder.class)
public abstract class MappingSet {

  public static Builder builder() {
    return Builder.builder();
  }

  public static MappingSet empty() {
    return builder().build();
  }

  @JsonProperty("mapRoles")
  public abstract ImmutableList<RoleMapping> roleMappings();

  @JsonProperty("mapUsers")
  public abstract ImmutableList<UserMapping> userMappings();

  @JsonProperty("mapAccounts")
  public abstract ImmutableList<String> autoMappedAccounts();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_MappingSet.Builder()
          .setRoleMappings(ImmutableList.of())
          .setUserMappings(ImmutableList.of())
          .setAutoMappedAccounts(ImmutableList.of());
    }

    @JsonProperty("mapRoles")
    public abstract Builder setRoleMappings(List<RoleMapping> roleMappings);

    @JsonProperty("mapUsers")
    public abstract Builder setUserMappings(List<UserMapping> userMappings);

    @JsonProperty("mapAccounts")
    public abstract Builder setAutoMappedAccounts(List<String> autoMappedAccounts);

    public abstract MappingSet build();
  }
}
