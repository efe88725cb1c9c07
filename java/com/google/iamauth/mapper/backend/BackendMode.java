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

package com.google.iamauth.mapper.backend;

import static com.google.iamauth.mapper.model.ErrorReason.EMPTY_BACKEND_MODE;
import static com.google.iamauth.mapper.model.ErrorReason.UNKNOWN_BACKEND;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.config.ConfigurationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Backends mappings can be read from. */
public enum BackendMode {
  /** Mappings embedded in the server configuration file. */
  FILE("File"),
  /** A separately mounted YAML file, re-read on every reload. */
  MOUNTED_FILE("MountedFile"),
  /** The {@code aws-auth} ConfigMap in {@code kube-system}. */
  EKS_CONFIG_MAP("EKSConfigMap"),
  /** {@code IAMIdentityMapping} custom resources. */
  CRD("CRD");

  private final String configName;

  BackendMode(String configName) {
    this.configName = configName;
  }

  /** The name used in configuration and flags. */
  public String getConfigName() {
    return configName;
  }

  /** Looks up a backend by its configuration name. */
  public static BackendMode fromConfigName(String name) throws ConfigurationException {
    for (BackendMode mode : values()) {
      if (mode.configName.equals(name)) {
        return mode;
      }
    }
    throw new ConfigurationException(
        String.format(
            "Unknown backend '%s', expected one of File, MountedFile, EKSConfigMap, CRD.", name),
        UNKNOWN_BACKEND);
  }

  /**
   * Parses an ordered backend list. Repeated names keep their first position.
   *
   * @throws ConfigurationException if the list is empty or names an unknown backend
   */
  public static ImmutableList<BackendMode> parseOrder(List<String> names)
      throws ConfigurationException {
    if (names.isEmpty()) {
      throw new ConfigurationException(
          "At least one backend must be configured.", EMPTY_BACKEND_MODE);
    }
    Set<BackendMode> order = new LinkedHashSet<>();
    for (String name : names) {
      order.add(fromConfigName(name.trim()));
    }
    return ImmutableList.copyOf(order);
  }

  @Override
  public String toString() {
    return configName;
  }
}
