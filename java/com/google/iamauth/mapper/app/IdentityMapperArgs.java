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

package com.google.iamauth.mapper.app;

import com.beust.jcommander.Parameter;
import com.google.common.base.Splitter;
import com.google.iamauth.mapper.model.Config;
import java.nio.file.Path;
import java.util.Optional;

/** Runtime arguments for the identity mapper. Flags that are set override the config file. */
public final class IdentityMapperArgs {

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  @Parameter(names = "--config", description = "Path of the YAML configuration file")
  private String configPath = "";

  @Parameter(
      names = "--partition",
      description = "AWS partition caller ARNs must belong to, e.g. aws, aws-cn or aws-us-gov")
  private String partition = "";

  @Parameter(names = "--cluster_id", description = "Unique-per-cluster identifier")
  private String clusterId = "";

  @Parameter(
      names = "--backend_mode",
      description =
          "Comma separated, ordered list of backends to read mappings from: File, MountedFile,"
              + " EKSConfigMap, CRD")
  private String backendMode = "";

  @Parameter(
      names = "--mounted_file_path",
      description = "YAML file with mapRoles, mapUsers and mapAccounts for the MountedFile backend")
  private String mountedFilePath = "";

  @Parameter(
      names = "--config_map_data_path",
      description = "File holding the aws-auth ConfigMap for the EKSConfigMap backend")
  private String configMapDataPath = "";

  @Parameter(
      names = "--identity_mappings_path",
      description = "File listing IAMIdentityMapping resources for the CRD backend")
  private String identityMappingsPath = "";

  @Parameter(
      names = "--reload_interval_seconds",
      description = "Seconds between two reloads of all backends")
  private int reloadIntervalSeconds;

  @Parameter(
      names = "--reload_deadline_seconds",
      description = "Seconds all backends together may take to respond during a reload")
  private int reloadDeadlineSeconds;

  @Parameter(
      names = "--resolve_arn",
      description =
          "If set, loads the mappings once, prints the TokenReview for this caller ARN and exits")
  private String resolveArn = "";

  @Parameter(
      names = "--resolve_account_id",
      description = "Caller account ID to use with --resolve_arn")
  private String resolveAccountId = "";

  @Parameter(
      names = "--resolve_session_name",
      description = "Caller session name to use with --resolve_arn")
  private String resolveSessionName = "";

  @Parameter(names = "--help", help = true, description = "Prints usage")
  private boolean help = false;

  public Optional<Path> getConfigPath() {
    return nonEmpty(configPath).map(Path::of);
  }

  public Optional<String> getResolveArn() {
    return nonEmpty(resolveArn);
  }

  public String getResolveAccountId() {
    return resolveAccountId;
  }

  public String getResolveSessionName() {
    return resolveSessionName;
  }

  public boolean isHelp() {
    return help;
  }

  /** Returns {@code config} with every flag that was set applied on top. */
  public Config applyOverrides(Config config) {
    Config.Builder builder = config.toBuilder();
    nonEmpty(partition).ifPresent(builder::setPartitionId);
    nonEmpty(clusterId).ifPresent(builder::setClusterId);
    nonEmpty(backendMode).ifPresent(modes -> builder.setBackendMode(COMMA.splitToList(modes)));
    nonEmpty(mountedFilePath).ifPresent(builder::setMountedFilePath);
    nonEmpty(configMapDataPath).ifPresent(builder::setConfigMapDataPath);
    nonEmpty(identityMappingsPath).ifPresent(builder::setIdentityMappingsPath);
    if (reloadIntervalSeconds > 0) {
      builder.setReloadIntervalSeconds(reloadIntervalSeconds);
    }
    if (reloadDeadlineSeconds > 0) {
      builder.setReloadDeadlineSeconds(reloadDeadlineSeconds);
    }
    return builder.build();
  }

  private static Optional<String> nonEmpty(String value) {
    return Optional.of(value).filter(v -> !v.isEmpty());
  }
}
