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

package com.google.iamauth.mapper.config;

import static com.google.iamauth.mapper.model.ErrorReason.DUPLICATE_ARN;
import static com.google.iamauth.mapper.model.ErrorReason.INVALID_ACCOUNT_ID;
import static com.google.iamauth.mapper.model.ErrorReason.INVALID_MAPPING_ARN;
import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_CONFIG;
import static com.google.iamauth.mapper.model.ErrorReason.UNKNOWN_PARTITION;

import com.google.common.collect.ImmutableSet;
import com.google.iamauth.mapper.arn.PrincipalArn;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.model.Config;
import com.google.iamauth.mapper.model.MappingKind;
import com.google.iamauth.mapper.model.MappingSet;
import com.google.iamauth.mapper.model.RoleMapping;
import com.google.iamauth.mapper.model.UserMapping;
import com.google.iamauth.mapper.template.TemplateExpander;
import com.google.iamauth.mapper.template.UnresolvedTemplateException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Checks a {@link Config} and the {@link MappingSet}s of each backend before they are used. */
public final class ConfigValidator {

  /** Partitions listed by the AWS SDK endpoint metadata. */
  public static final ImmutableSet<String> KNOWN_PARTITIONS =
      ImmutableSet.of("aws", "aws-cn", "aws-us-gov", "aws-iso", "aws-iso-b");

  private ConfigValidator() {}

  /**
   * Validates the server configuration. Embedded mappings are validated separately, when the
   * {@code File} backend is loaded.
   *
   * @throws ConfigurationException on the first problem found
   */
  public static void validate(Config config) throws ConfigurationException {
    if (!KNOWN_PARTITIONS.contains(config.partitionId())) {
      throw new ConfigurationException(
          String.format(
              "Unknown partition '%s', expected one of %s.",
              config.partitionId(), KNOWN_PARTITIONS),
          UNKNOWN_PARTITION);
    }
    for (BackendMode backend : BackendMode.parseOrder(config.backendMode())) {
      validateBackendSettings(config, backend);
    }
    if (config.reloadIntervalSeconds() <= 0 || config.reloadDeadlineSeconds() <= 0) {
      throw new ConfigurationException(
          "reloadIntervalSeconds and reloadDeadlineSeconds must be positive.", MALFORMED_CONFIG);
    }
    validateAccounts(config.autoMappedAwsAccounts(), "auto-mapped");
    validateAccounts(config.scrubbedAwsAccounts(), "scrubbed");
  }

  /**
   * Validates the mappings of one backend: every ARN is an IAM role or user ARN of the right kind,
   * no ARN appears twice in the same list, and every pattern only uses recognized tokens.
   *
   * @throws ConfigurationException on the first problem found
   */
  public static void validateMappingSet(MappingSet mappingSet) throws ConfigurationException {
    Set<String> seen = new HashSet<>();
    for (RoleMapping mapping : mappingSet.roleMappings()) {
      validateMapping(
          mapping.roleArn(), MappingKind.ROLE, mapping.username(), mapping.groups(), seen);
    }
    seen.clear();
    for (UserMapping mapping : mappingSet.userMappings()) {
      validateMapping(
          mapping.userArn(), MappingKind.USER, mapping.username(), mapping.groups(), seen);
    }
    validateAccounts(mappingSet.autoMappedAccounts(), "auto-mapped");
  }

  private static void validateBackendSettings(Config config, BackendMode backend)
      throws ConfigurationException {
    Optional<String> path;
    String setting;
    switch (backend) {
      case MOUNTED_FILE:
        path = config.mountedFilePath();
        setting = "mountedFilePath";
        break;
      case EKS_CONFIG_MAP:
        path = config.configMapDataPath();
        setting = "configMapDataPath";
        break;
      case CRD:
        path = config.identityMappingsPath();
        setting = "identityMappingsPath";
        break;
      default:
        return;
    }
    if (path.filter(value -> !value.isBlank()).isEmpty()) {
      throw new ConfigurationException(
          String.format("Backend %s requires %s to be set.", backend, setting), MALFORMED_CONFIG);
    }
  }

  private static void validateMapping(
      String arn, MappingKind kind, String username, List<String> groups, Set<String> seen)
      throws ConfigurationException {
    Optional<PrincipalArn> parsed = PrincipalArn.parse(arn);
    if (parsed.isEmpty() || parsed.get().isAssumedRole() || parsed.get().kind() != kind) {
      throw new ConfigurationException(
          String.format("'%s' is not a valid IAM %s ARN.", arn, kind.getResourceType()),
          INVALID_MAPPING_ARN);
    }
    if (!seen.add(arn)) {
      throw new ConfigurationException(
          String.format("%s ARN '%s' is mapped more than once.", kind.getResourceType(), arn),
          DUPLICATE_ARN);
    }
    try {
      TemplateExpander.validate(username, kind);
      for (String group : groups) {
        TemplateExpander.validate(group, kind);
      }
    } catch (UnresolvedTemplateException e) {
      throw new ConfigurationException(
          String.format("Invalid mapping for '%s': %s", arn, e.getMessage()), e.getReason(), e);
    }
  }

  private static void validateAccounts(List<String> accounts, String description)
      throws ConfigurationException {
    for (String account : accounts) {
      if (!isAccountId(account)) {
        throw new ConfigurationException(
            String.format("Invalid %s account '%s', expected 12 digits.", description, account),
            INVALID_ACCOUNT_ID);
      }
    }
  }

  /** Whether {@code value} is a 12 digit AWS account ID. */
  public static boolean isAccountId(String value) {
    return value.length() == 12 && value.chars().allMatch(c -> c >= '0' && c <= '9');
  }
}
