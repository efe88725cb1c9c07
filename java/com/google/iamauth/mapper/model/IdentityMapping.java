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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Mapping of an IAM principal ARN of either kind to a Kubernetes identity. This is the shape of the
 * {@code spec} of an {@code IAMIdentityMapping} custom resource, where the ARN's resource type
 * tells whether the mapping is for a role or a user.
 */
@AutoValue
@JsonDeserialize(builder = IdentityMapping.Builder.class)
public abstract class IdentityMapping {

  public static Builder builder() {
    return Builder.builder();
  }

  @JsonProperty("arn")
  public abstract String identityArn();

  @JsonProperty("username")
  public abstract String username();

  @JsonProperty("groups")
  public abstract ImmutableList<String> groups();

  public RoleMapping toRoleMapping() {
    return RoleMapping.builder()
        .setRoleArn(identityArn())
        .setUsername(username())
        .setGroups(groups())
        .build();
  }

  public UserMapping toUserMapping() {
    return UserMapping.builder()
        .setUserArn(identityArn())
        .setUsername(username())
        .setGroups(groups())
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_IdentityMapping.Builder().setGroups(ImmutableList.of());
    }

    @JsonProperty("arn")
    @JsonAlias({"identityARN", "IdentityARN"})
    public abstract Builder setIdentityArn(String identityArn);

    @JsonProperty("username")
    public abstract Builder setUsername(String username);

    @JsonProperty("groups")
    public abstract Builder setGroups(List<String> groups);

    public abstract IdentityMapping build();
  }
}
