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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the ConfigMap from a local file, either a full ConfigMap manifest or just its {@code data}
 * map. This helps with running the mapper without an API server, e.g. with the ConfigMap projected
 * into a volume.
 *
 * <p>Values written as YAML lists or maps instead of strings are serialized back to a YAML string,
 * so they parse the same way as the string form.
 */
public final class LocalConfigMapDataProvider implements ConfigMapDataProvider {

  private final Path path;
  private final ObjectMapper mapper;

  public LocalConfigMapDataProvider(Path path, ObjectMapper mapper) {
    this.path = path;
    this.mapper = mapper;
  }

  @Override
  public ImmutableMap<String, String> getData() throws MappingSourceException {
    JsonNode root;
    try {
      root = mapper.readTree(Files.readString(path));
    } catch (NoSuchFileException e) {
      throw new MappingSourceException(
          String.format("ConfigMap file %s does not exist.", path), BACKEND_UNAVAILABLE, e);
    } catch (IOException e) {
      throw new MappingSourceException(
          String.format("Could not read ConfigMap file %s.", path), MALFORMED_BACKEND_DATA, e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      return ImmutableMap.of();
    }
    JsonNode data = root.has("data") ? root.get("data") : root;
    if (!data.isObject()) {
      throw new MappingSourceException(
          String.format("ConfigMap file %s has no data map.", path), MALFORMED_BACKEND_DATA);
    }
    ImmutableMap.Builder<String, String> entries = ImmutableMap.builder();
    for (Iterator<Map.Entry<String, JsonNode>> it = data.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      entries.put(entry.getKey(), valueOf(entry.getKey(), entry.getValue()));
    }
    return entries.build();
  }

  private String valueOf(String key, JsonNode value) throws MappingSourceException {
    if (!value.isContainerNode()) {
      return value.asText();
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new MappingSourceException(
          String.format("Could not read %s of ConfigMap file %s.", key, path),
          MALFORMED_BACKEND_DATA,
          e);
    }
  }
}
