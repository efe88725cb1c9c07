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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.backend.MappingSource;
import com.google.iamauth.mapper.config.Annotations.BackendOrder;
import com.google.iamauth.mapper.index.MappingIndex;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the published {@link MappingIndex} and replaces it on reload.
 *
 * <p>A reload builds a new index from scratch and publishes it with a single reference swap.
 * Readers never lock; a reader that took the index before a swap keeps using that snapshot. If a
 * reload yields no index, the previous one keeps serving.
 */
@Singleton
public final class MappingIndexHolder {

  private static final Logger logger = LoggerFactory.getLogger(MappingIndexHolder.class);

  private final BackendMergeCoordinator coordinator;
  private final ImmutableList<BackendMode> backendOrder;
  private final ImmutableMap<BackendMode, MappingSource> sources;
  private final AtomicReference<MappingIndex> current = new AtomicReference<>();
  // Serializes reloads so an older build can never be published over a newer one.
  private final Object reloadLock = new Object();

  @Inject
  public MappingIndexHolder(
      BackendMergeCoordinator coordinator,
      @BackendOrder ImmutableList<BackendMode> backendOrder,
      ImmutableMap<BackendMode, MappingSource> sources) {
    this.coordinator = coordinator;
    this.backendOrder = backendOrder;
    this.sources = sources;
  }

  /** The published index, empty until the first successful reload. */
  public Optional<MappingIndex> current() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Rebuilds the index from all backends and publishes it.
   *
   * @param deadline time allowed for fetching all backends
   * @return the report of the build
   * @throws MappingBuildException if every backend failed and no index was ever published
   */
  public BuildReport reload(Duration deadline) throws MappingBuildException {
    synchronized (reloadLock) {
      BuildReport report = coordinator.build(backendOrder, sources, deadline);
      if (report.index().isPresent()) {
        MappingIndex index = report.index().get();
        current.set(index);
        logger.info(
            "Published mapping index generation {}: {} role mappings, {} user mappings, {}"
                + " auto-mapped accounts from {} of {} backends, {} conflicts",
            index.getGeneration(),
            index.getRoleMappingCount(),
            index.getUserMappingCount(),
            index.getAutoMappedAccountCount(),
            report.healthyBackendCount(),
            report.backendHealth().size(),
            report.conflicts().size());
        return report;
      }
      MappingIndex stale = current.get();
      if (stale == null) {
        throw new MappingBuildException(
            String.format("None of the backends %s could be loaded", backendOrder), report);
      }
      logger.error(
          "None of the backends {} could be loaded; still serving mapping index generation {}",
          backendOrder,
          stale.getGeneration());
      return report;
    }
  }
}
