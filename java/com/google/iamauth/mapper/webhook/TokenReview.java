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

package com.google.iamauth.mapper.webhook;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code TokenReview} object returned to the Kubernetes API server by an authentication
 * webhook. Only the response side is modeled: the status, and the user it authenticated.
 */
@AutoValue
@JsonDeserialize(builder = TokenReview.Builder.class)
@JsonSerialize(as = TokenReview.class)
@JsonPropertyOrder({"apiVersion", "kind", "status"})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TokenReview {

  public static final String API_VERSION = "authentication.k8s.io/v1beta1";
  public static final String KIND = "TokenReview";

  public static Builder builder() {
    return Builder.builder();
  }

  @JsonProperty("apiVersion")
  public abstract String apiVersion();

  @JsonProperty("kind")
  public abstract String kind();

  @JsonProperty("status")
  public abstract Status status();

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_TokenReview.Builder().setApiVersion(API_VERSION).setKind(KIND);
    }

    @JsonProperty("apiVersion")
    public abstract Builder setApiVersion(String apiVersion);

    @JsonProperty("kind")
    public abstract Builder setKind(String kind);

    @JsonProperty("status")
    public abstract Builder setStatus(Status status);

    public abstract TokenReview build();
  }

  /** Whether the caller was authenticated, and as whom. */
  @AutoValue
  @JsonDeserialize(builder = Status.Builder.class)
  @JsonSerialize(as = Status.class)
  @JsonPropertyOrder({"authenticated", "user", "error"})
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class Status {

    public static Builder builder() {
      return Builder.builder();
    }

    @JsonProperty("authenticated")
    public abstract boolean authenticated();

    /** Present only when authenticated. */
    @JsonProperty("user")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<UserInfo> user();

    /** Reason the caller was not authenticated. */
    @JsonProperty("error")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<String> error();

    @AutoValue.Builder
    public abstract static class Builder {

      @JsonCreator
      public static Builder builder() {
        return new AutoValue_TokenReview_Status.Builder();
      }

      @JsonProperty("authenticated")
      public abstract Builder setAuthenticated(boolean authenticated);

      @JsonProperty("user")
      public abstract Builder setUser(UserInfo user);

      @JsonProperty("error")
      public abstract Builder setError(String error);

      public abstract Status build();
    }
  }

  /** The Kubernetes user of an authenticated caller. */
  @AutoValue
  @JsonDeserialize(builder = UserInfo.Builder.class)
  @JsonSerialize(as = UserInfo.class)
  @JsonPropertyOrder({"username", "groups", "extra"})
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class UserInfo {

    public static Builder builder() {
      return Builder.builder();
    }

    @JsonProperty("username")
    public abstract String username();

    @JsonProperty("groups")
    public abstract ImmutableList<String> groups();

    /** Extra attributes, passed on to authorizers and audit logs. */
    @JsonProperty("extra")
    public abstract ImmutableMap<String, ImmutableList<String>> extra();

    @AutoValue.Builder
    public abstract static class Builder {

      @JsonCreator
      public static Builder builder() {
        return new AutoValue_TokenReview_UserInfo.Builder()
            .setGroups(ImmutableList.of())
            .setExtra(ImmutableMap.of());
      }

      @JsonProperty("username")
      public abstract Builder setUsername(String username);

      @JsonProperty("groups")
      public abstract Builder setGroups(List<String> groups);

      @JsonProperty("extra")
      public abstract Builder setExtra(Map<String, ImmutableList<String>> extra);

      public abstract UserInfo build();
    }
  }
}
