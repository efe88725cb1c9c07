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

import static com.google.iamauth.mapper.model.ErrorReason.BACKEND_UNAVAILABLE;
import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_BACKEND_DATA;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import com.google.iamauth.mapper.model.IdentityMapping;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads {@code IAMIdentityMapping} resources from a local file holding a resource list, as written
 * by {@code kubectl get iamidentitymappings -o yaml}:
 *
 * <pre>
 * items:
 *   - metadata:
 *       name: kubernetes-admin
 *     spec:
 *       arn: arn:aws:iam::000000000000:user/KubernetesAdmin
 *       username: kubernetes-admin
 *       groups:
 *         - system:masters
 * </pre>
 */
public final class LocalIdentityMappingProvider implements IdentityMappingProvider {

  private final Path path;
  private final ObjectMapper mapper;

  public LocalIdentityMappingProvider(Path path, ObjectMapper mapper) {
    this.path = path;
    this.mapper = mapper;
  }

  @Override
  public ImmutableList<IdentityMapping> listIdentityMappings() throws MappingSourceException {
    JsonNode root;
    try {
      root = mapper.readTree(Files.readString(path));
    } catch (NoSuchFileException e) {
      throw new MappingSourceException(
          String.format("Identity mapping file %s does not exist.", path), BACKEND_UNAVAILABLE, e);
    } catch (IOException e) {
      throw new MappingSourceException(
          String.format("Could not read identity mapping file %s.", path),
          MALFORMED_BACKEND_DATA,
          e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      return ImmutableList.of();
    }
    JsonNode items = root.isArray() ? root : root.path("items");
    if (!items.isArray()) {
      throw new MappingSourceException(
          String.format("Identity mapping file %s has no items list.", path),
          MALFORMED_BACKEND_DATA);
    }
    ImmutableList.Builder<IdentityMapping> mappings = ImmutableList.builder();
    for (JsonNode item : items) {
      JsonNode spec = item.path("spec");
      if (!spec.isObject()) {
        throw new MappingSourceException(
            String.format("Identity mapping in %s has no spec.", path), MALFORMED_BACKEND_DATA);
      }
      try {
        mappings.add(mapper.treeToValue(spec, IdentityMapping.class));
      } catch (IOException | IllegalArgumentException | IllegalStateException e) {
        throw new MappingSourceException(
            String.format("Invalid identity mapping spec in %s.", path), MALFORMED_BACKEND_DATA, e);
      }
    }
    return mappings.build();
  }
}
