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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.iamauth.mapper.model.MappingSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads mappings from a mounted YAML file with {@code mapRoles}, {@code mapUsers} and {@code
 * mapAccounts} lists. The file is read again on every fetch so that updates to the mount are picked
 * up by the next reload.
 */
public final class MountedFileMappingSource implements MappingSource {

  private static final Logger logger = LoggerFactory.getLogger(MountedFileMappingSource.class);

  private final Path path;
  private final ObjectMapper mapper;

  public MountedFileMappingSource(Path path, ObjectMapper mapper) {
    this.path = path;
    this.mapper = mapper;
  }

  @Override
  public BackendMode getBackendMode() {
    return BackendMode.MOUNTED_FILE;
  }

  @Override
  public MappingSet fetch() throws MappingSourceException {
    String content;
    try {
      content = Files.readString(path);
    } catch (IOException e) {
      throw new MappingSourceException(
          String.format("Could not read mounted mapping file %s.", path), BACKEND_UNAVAILABLE, e);
    }
    if (content.isBlank()) {
      logger.warn("Mounted mapping file {} is empty", path);
      return MappingSet.empty();
    }
    try {
      return mapper.readValue(content, MappingSet.class);
    } catch (JsonProcessingException e) {
      throw new MappingSourceException(
          String.format("Could not parse mounted mapping file %s.", path),
          MALFORMED_BACKEND_DATA,
          e);
    }
  }
}
