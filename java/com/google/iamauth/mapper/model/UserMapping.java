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
 * Static mapping of a single IAM user ARN to a Kubernetes username and list of groups. Only
 * {@code {{AccountID}}} may be used in the patterns.
 */
@AutoValue
@JsonDeserialize(builder = UserMapping.Builder.class)
public abstract class UserMapping {

  public static Builder builder() {
    return Builder.builder();
  }

  /** ARN of the user, e.g. {@code arn:aws:iam::000000000000:user/Test}. */
  @JsonProperty("userarn")
  public abstract String userArn();

  @JsonProperty("username")
  public abstract String username();

  @JsonProperty("groups")
  public abstract ImmutableList<String> groups();

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_UserMapping.Builder().setGroups(ImmutableList.of());
    }

    @JsonProperty("userarn")
    @JsonAlias({"userARN", "UserARN"})
    public abstract Builder setUserArn(String userArn);

    @JsonProperty("username")
    @JsonAlias("Username")
    public abstract Builder setUsername(String username);

    @JsonProperty("groups")
    @JsonAlias("Groups")
    public abstract Builder setGroups(List<String> groups);

    public abstract UserMapping build();
  }
}
