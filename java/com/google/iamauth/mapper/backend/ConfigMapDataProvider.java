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

import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;

/** Supplies the data of the {@code kube-system/aws-auth} ConfigMap. */
public interface ConfigMapDataProvider {

  /**
   * Blocking call returning the ConfigMap's {@code data} entries.
   *
   * @throws MappingSourceException if the ConfigMap could not be read
   */
  ImmutableMap<String, String> getData() throws MappingSourceException;
}
