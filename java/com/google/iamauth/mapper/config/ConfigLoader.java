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

import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_CONFIG;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.iamauth.mapper.model.Config;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads and validates the server configuration file. */
public final class ConfigLoader {

  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  private final ObjectMapper mapper;

  public ConfigLoader() {
    this(new YamlObjectMapper());
  }

  ConfigLoader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Loads a YAML (or JSON) configuration file. The result is not validated, since flags may still
   * override it; see {@link ConfigValidator#validate}.
   *
   * @throws ConfigurationException if the file cannot be read or is not a valid configuration
   */
  public Config load(Path path) throws ConfigurationException {
    Config config;
    try {
      config = mapper.readValue(path.toFile(), Config.class);
    } catch (IOException e) {
      throw new ConfigurationException(
          String.format("Could not read configuration file %s.", path), MALFORMED_CONFIG, e);
    }
    logger.info("Loaded configuration from {}", path);
    return config;
  }
}
