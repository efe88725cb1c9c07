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

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import com.google.iamauth.mapper.model.IdentityMapping;

/** Supplies the specs of all {@code IAMIdentityMapping} custom resources of the cluster. */
public interface IdentityMappingProvider {

  /**
   * Blocking call listing the current resources, in the order they should take precedence.
   *
   * @throws MappingSourceException if the resources could not be listed
   */
  ImmutableList<IdentityMapping> listIdentityMappings() throws MappingSourceException;
}
