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
 * Maps an IAM role ARN to a Kubernetes username and list of groups.
 *
 * <p>The username and groups are templates that may contain two parameters:
 *
 * <ul>
 *   <li>{@code {{AccountID}}} is the 12 digit AWS account ID.
 *   <li>{@code {{SessionName}}} is the role session name. For an EC2 instance role this is the
 *       instance ID, for a federated role the federated identity, and for a role assumed directly
 *       with {@code sts:AssumeRole} a caller chosen string.
 * </ul>
 */
@AutoValue
@JsonDeserialize(builder = RoleMapping.Builder.class)
public abstract class RoleMapping {

  public static Builder builder() {
    return Builder.builder();
  }

  /** ARN of the role, e.g. {@code arn:aws:iam::000000000000:role/Foo}. */
  @JsonProperty("rolearn")
  public abstract String roleArn();

  /** Username pattern for principals assuming this role. */
  @JsonProperty("username")
  public abstract String username();

  /** Group patterns, e.g. {@code system:masters}. */
  @JsonProperty("groups")
  public abstract ImmutableList<String> groups();

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_RoleMapping.Builder().setGroups(ImmutableList.of());
    }

    @JsonProperty("rolearn")
    @JsonAlias({"roleARN", "RoleARN"})
    public abstract Builder setRoleArn(String roleArn);

    @JsonProperty("username")
    @JsonAlias("Username")
    public abstract Builder setUsername(String username);

    @JsonProperty("groups")
    @JsonAlias("Groups")
    public abstract Builder setGroups(List<String> groups);

    public abstract RoleMapping build();
  }
}
