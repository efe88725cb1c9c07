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

import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_BACKEND_DATA;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.model.MappingSet;
import com.google.iamauth.mapper.model.RoleMapping;
import com.google.iamauth.mapper.model.UserMapping;
import java.util.List;

/**
 * Reads mappings from the {@code aws-auth} ConfigMap. Each of its data keys holds a YAML document:
 *
 * <pre>
 * mapRoles: |
 *   - rolearn: arn:aws:iam::000000000000:role/KubernetesNode
 *     username: system:node:{{SessionName}}
 *     groups:
 *       - system:nodes
 * mapUsers: |
 *   - userarn: arn:aws:iam::000000000000:user/Alice
 *     username: alice
 * mapAccounts: |
 *   - "000000000000"
 * </pre>
 */
public final class ConfigMapMappingSource implements MappingSource {

  public static final String MAP_ROLES = "mapRoles";
  public static final String MAP_USERS = "mapUsers";
  public static final String MAP_ACCOUNTS = "mapAccounts";

  private static final TypeReference<List<RoleMapping>> ROLE_MAPPINGS = new TypeReference<>() {};
  private static final TypeReference<List<UserMapping>> USER_MAPPINGS = new TypeReference<>() {};
  private static final TypeReference<List<String>> ACCOUNTS = new TypeReference<>() {};

  private final ConfigMapDataProvider dataProvider;
  private final ObjectMapper mapper;

  public ConfigMapMappingSource(ConfigMapDataProvider dataProvider, ObjectMapper mapper) {
    this.dataProvider = dataProvider;
    this.mapper = mapper;
  }

  @Override
  public BackendMode getBackendMode() {
    return BackendMode.EKS_CONFIG_MAP;
  }

  @Override
  public MappingSet fetch() throws MappingSourceException {
    ImmutableMap<String, String> data = dataProvider.getData();
    return MappingSet.builder()
        .setRoleMappings(parse(data, MAP_ROLES, ROLE_MAPPINGS))
        .setUserMappings(parse(data, MAP_USERS, USER_MAPPINGS))
        .setAutoMappedAccounts(parse(data, MAP_ACCOUNTS, ACCOUNTS))
        .build();
  }

  private <T> List<T> parse(
      ImmutableMap<String, String> data, String key, TypeReference<List<T>> type)
      throws MappingSourceException {
    String value = data.get(key);
    if (value == null || value.isBlank()) {
      return ImmutableList.of();
    }
    try {
      List<T> parsed = mapper.readValue(value, type);
      return parsed == null ? ImmutableList.of() : parsed;
    } catch (JsonProcessingException e) {
      throw new MappingSourceException(
          String.format("Could not parse %s of the aws-auth ConfigMap.", key),
          MALFORMED_BACKEND_DATA,
          e);
    }
  }
}
