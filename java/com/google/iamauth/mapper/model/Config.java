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
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Server configuration for the identity mapper. Read-only once loaded. */
@AutoValue
@JsonDeserialize(builder = Config.Builder.class)
public abstract class Config {

  public static final String DEFAULT_PARTITION = "aws";
  public static final int DEFAULT_RELOAD_INTERVAL_SECONDS = 60;
  public static final int DEFAULT_RELOAD_DEADLINE_SECONDS = 10;

  public static Builder builder() {
    return Builder.builder();
  }

  /** The AWS partition caller ARNs are valid in, e.g. {@code aws} or {@code aws-cn}. */
  @JsonProperty("partition")
  public abstract String partitionId();

  /** Unique-per-cluster identifier of this installation. */
  @JsonProperty("clusterID")
  public abstract String clusterId();

  /** Role mappings served by the {@code File} backend. */
  @JsonProperty("mapRoles")
  public abstract ImmutableList<RoleMapping> roleMappings();

  /** User mappings served by the {@code File} backend. */
  @JsonProperty("mapUsers")
  public abstract ImmutableList<UserMapping> userMappings();

  /**
   * Accounts whose principals are allowed without an explicit mapping. The ARN becomes the
   * username.
   */
  @JsonProperty("mapAccounts")
  public abstract ImmutableList<String> autoMappedAwsAccounts();

  /** Accounts whose ARNs are redacted from log statements. */
  @JsonProperty("scrubbedAccounts")
  public abstract ImmutableList<String> scrubbedAwsAccounts();

  /** Ordered list of backends to get mappings from: File, MountedFile, EKSConfigMap, CRD. */
  @JsonProperty("backendMode")
  public abstract ImmutableList<String> backendMode();

  /** Path of the YAML file read by the {@code MountedFile} backend. */
  @JsonProperty("mountedFilePath")
  public abstract Optional<String> mountedFilePath();

  /** Path of the file holding the {@code aws-auth} ConfigMap data for {@code EKSConfigMap}. */
  @JsonProperty("configMapDataPath")
  public abstract Optional<String> configMapDataPath();

  /** Path of the file listing {@code IAMIdentityMapping} resources for {@code CRD}. */
  @JsonProperty("identityMappingsPath")
  public abstract Optional<String> identityMappingsPath();

  @JsonProperty("reloadIntervalSeconds")
  public abstract int reloadIntervalSeconds();

  @JsonProperty("reloadDeadlineSeconds")
  public abstract int reloadDeadlineSeconds();

  public abstract Builder toBuilder();

  /** Mappings embedded in this configuration, as served by the {@code File} backend. */
  public MappingSet embeddedMappings() {
    return MappingSet.builder()
        .setRoleMappings(roleMappings())
        .setUserMappings(userMappings())
        .setAutoMappedAccounts(autoMappedAwsAccounts())
        .build();
  }

  public Duration reloadInterval() {
    return Duration.ofSeconds(reloadIntervalSeconds());
  }

  public Duration reloadDeadline() {
    return Duration.ofSeconds(reloadDeadlineSeconds());
  }

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_Config.Builder()
          .setPartitionId(DEFAULT_PARTITION)
          .setClusterId("")
          .setRoleMappings(ImmutableList.of())
          .setUserMappings(ImmutableList.of())
          .setAutoMappedAwsAccounts(ImmutableList.of())
          .setScrubbedAwsAccounts(ImmutableList.of())
          .setBackendMode(ImmutableList.of("File"))
          .setReloadIntervalSeconds(DEFAULT_RELOAD_INTERVAL_SECONDS)
          .setReloadDeadlineSeconds(DEFAULT_RELOAD_DEADLINE_SECONDS);
    }

    @JsonProperty("partition")
    public abstract Builder setPartitionId(String partitionId);

    @JsonProperty("clusterID")
    public abstract Builder setClusterId(String clusterId);

    @JsonProperty("mapRoles")
    public abstract Builder setRoleMappings(List<RoleMapping> roleMappings);

    @JsonProperty("mapUsers")
    public abstract Builder setUserMappings(List<UserMapping> userMappings);

    @JsonProperty("mapAccounts")
    public abstract Builder setAutoMappedAwsAccounts(List<String> accounts);

    @JsonProperty("scrubbedAccounts")
    public abstract Builder setScrubbedAwsAccounts(List<String> accounts);

    @JsonProperty("backendMode")
    public abstract Builder setBackendMode(List<String> backendMode);

    @JsonProperty("mountedFilePath")
    public abstract Builder setMountedFilePath(String path);

    @JsonProperty("configMapDataPath")
    public abstract Builder setConfigMapDataPath(String path);

    @JsonProperty("identityMappingsPath")
    public abstract Builder setIdentityMappingsPath(String path);

    @JsonProperty("reloadIntervalSeconds")
    public abstract Builder setReloadIntervalSeconds(int seconds);

    @JsonProperty("reloadDeadlineSeconds")
    public abstract Builder setReloadDeadlineSeconds(int seconds);

    public abstract Config build();
  }
}
