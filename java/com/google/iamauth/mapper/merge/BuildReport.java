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

package com.google.iamauth.mapper.merge;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.index.MappingIndex;
import java.util.Optional;

/** Result of merging all backends: the new index if any backend was healthy, and diagnostics. */
@AutoValue
public abstract class BuildReport {

  public static BuildReport create(
      Optional<MappingIndex> index,
      ImmutableList<BackendHealth> backendHealth,
      ImmutableList<MappingConflict> conflicts) {
    return new AutoValue_BuildReport(index, backendHealth, conflicts);
  }

  /** Empty when every backend failed. */
  public abstract Optional<MappingIndex> index();

  /** Health of each backend, in backend order. */
  public abstract ImmutableList<BackendHealth> backendHealth();

  public abstract ImmutableList<MappingConflict> conflicts();

  public long healthyBackendCount() {
    return backendHealth().stream().filter(BackendHealth::isHealthy).count();
  }
}
