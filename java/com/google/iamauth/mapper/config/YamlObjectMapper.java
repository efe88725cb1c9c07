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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Object mapper for the YAML configuration and mapping files, with Guava and Optional support.
 * Since YAML is a superset of JSON it also reads JSON documents.
 */
public final class YamlObjectMapper extends ObjectMapper {

  public YamlObjectMapper() {
    super(new YAMLFactory());
    registerModule(new GuavaModule());
    registerModule(new Jdk8Module());
    // Kubernetes objects carry metadata that the mapper has no use for.
    configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
