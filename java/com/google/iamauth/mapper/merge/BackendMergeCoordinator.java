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

import static com.google.iamauth.mapper.model.ErrorReason.BACKEND_UNAVAILABLE;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.arn.ArnScrubber;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.backend.MappingSource;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import com.google.iamauth.mapper.config.Annotations.MappingFetchExecutor;
import com.google.iamauth.mapper.config.Annotations.PartitionId;
import com.google.iamauth.mapper.config.ConfigValidator;
import com.google.iamauth.mapper.config.ConfigurationException;
import com.google.iamauth.mapper.index.MappingIndex;
import com.google.iamauth.mapper.model.MappingKind;
import com.google.iamauth.mapper.model.MappingSet;
import com.google.iamauth.mapper.model.RoleMapping;
import com.google.iamauth.mapper.model.UserMapping;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the mappings of several backends into one {@link MappingIndex}.
 *
 * <p>Backends are fetched concurrently and each fetch is isolated: a backend that fails, times
 * out, or returns an invalid mapping set contributes nothing, and the others are merged without
 * it. When two backends map the same ARN the one earlier in the order wins and a {@link
 * MappingConflict} is recorded.
 */
@Singleton
public final class BackendMergeCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(BackendMergeCoordinator.class);

  private final String partitionId;
  private final ExecutorService fetchExecutor;
  private final ArnScrubber scrubber;
  private final AtomicLong generations = new AtomicLong();

  @Inject
  public BackendMergeCoordinator(
      @PartitionId String partitionId,
      @MappingFetchExecutor ExecutorService fetchExecutor,
      ArnScrubber scrubber) {
    this.partitionId = partitionId;
    this.fetchExecutor = fetchExecutor;
    this.scrubber = scrubber;
  }

  /**
   * Fetches every backend in {@code backendOrder} and merges the healthy ones.
   *
   * @param backendOrder backends in precedence order
   * @param sources the source of each backend; a backend without a source is unavailable
   * @param deadline time allowed for all fetches together
   * @return the report, holding a new index unless every backend failed
   */
  public BuildReport build(
      List<BackendMode> backendOrder, Map<BackendMode, MappingSource> sources, Duration deadline) {
    Map<BackendMode, Future<MappingSet>> fetches = new LinkedHashMap<>();
    Map<BackendMode, BackendHealth> health = new HashMap<>();
    for (BackendMode backend : backendOrder) {
      MappingSource source = sources.get(backend);
      if (source == null) {
        health.put(
            backend,
            BackendHealth.unhealthy(
                backend, BACKEND_UNAVAILABLE, "No source is configured for backend " + backend));
        continue;
      }
      fetches.put(backend, fetchExecutor.submit(() -> fetchAndValidate(source)));
    }

    long deadlineNanos = System.nanoTime() + deadline.toNanos();
    Map<BackendMode, MappingSet> fetched = new LinkedHashMap<>();
    for (Map.Entry<BackendMode, Future<MappingSet>> fetch : fetches.entrySet()) {
      BackendMode backend = fetch.getKey();
      try {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        fetched.put(backend, fetch.getValue().get(remaining, TimeUnit.NANOSECONDS));
        health.put(backend, BackendHealth.healthy(backend));
      } catch (TimeoutException e) {
        fetch.getValue().cancel(/* mayInterruptIfRunning= */ true);
        health.put(
            backend,
            BackendHealth.unhealthy(
                backend,
                BACKEND_UNAVAILABLE,
                String.format("Backend %s did not respond within %s", backend, deadline)));
      } catch (ExecutionException e) {
        health.put(backend, unhealthyFromCause(backend, e.getCause()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        fetch.getValue().cancel(/* mayInterruptIfRunning= */ true);
        health.put(
            backend,
            BackendHealth.unhealthy(backend, BACKEND_UNAVAILABLE, "Interrupted while fetching"));
      }
    }

    ImmutableList.Builder<BackendHealth> orderedHealth = ImmutableList.builder();
    for (BackendMode backend : backendOrder) {
      BackendHealth backendHealth = health.get(backend);
      orderedHealth.add(backendHealth);
      if (!backendHealth.isHealthy()) {
        logger.warn(
            "Backend {} is unhealthy ({}): {}",
            backend,
            backendHealth.errorReason().get(),
            scrubber.scrubText(backendHealth.errorMessage().get()));
      }
    }

    if (fetched.isEmpty()) {
      return BuildReport.create(Optional.empty(), orderedHealth.build(), ImmutableList.of());
    }
    ImmutableList.Builder<MappingConflict> conflicts = ImmutableList.builder();
    MappingIndex index = merge(fetched, conflicts);
    return BuildReport.create(Optional.of(index), orderedHealth.build(), conflicts.build());
  }

  private MappingIndex merge(
      Map<BackendMode, MappingSet> fetched, ImmutableList.Builder<MappingConflict> conflicts) {
    MappingIndex.Builder index =
        MappingIndex.builder(partitionId).setGeneration(generations.incrementAndGet());
    Map<String, BackendMode> roleOwners = new HashMap<>();
    Map<String, BackendMode> userOwners = new HashMap<>();
    for (Map.Entry<BackendMode, MappingSet> entry : fetched.entrySet()) {
      BackendMode backend = entry.getKey();
      MappingSet mappingSet = entry.getValue();
      for (RoleMapping mapping : mappingSet.roleMappings()) {
        BackendMode owner = roleOwners.putIfAbsent(mapping.roleArn(), backend);
        if (owner == null) {
          index.addRoleMapping(mapping, backend);
        } else {
          conflicts.add(recordConflict(mapping.roleArn(), MappingKind.ROLE, owner, backend));
        }
      }
      for (UserMapping mapping : mappingSet.userMappings()) {
        BackendMode owner = userOwners.putIfAbsent(mapping.userArn(), backend);
        if (owner == null) {
          index.addUserMapping(mapping, backend);
        } else {
          conflicts.add(recordConflict(mapping.userArn(), MappingKind.USER, owner, backend));
        }
      }
      for (String account : mappingSet.autoMappedAccounts()) {
        index.addAutoMappedAccount(account, backend);
      }
    }
    return index.build();
  }

  private MappingConflict recordConflict(
      String arn, MappingKind kind, BackendMode winner, BackendMode ignored) {
    logger.warn(
        "{} {} is mapped by both {} and {}; using the mapping from {}",
        kind.getResourceType(),
        scrubber.scrub(arn),
        winner,
        ignored,
        winner);
    return MappingConflict.of(arn, kind, winner, ignored);
  }

  private static MappingSet fetchAndValidate(MappingSource source)
      throws MappingSourceException, ConfigurationException {
    MappingSet mappingSet = source.fetch();
    ConfigValidator.validateMappingSet(mappingSet);
    return mappingSet;
  }

  private static BackendHealth unhealthyFromCause(BackendMode backend, Throwable cause) {
    if (cause instanceof MappingSourceException) {
      return BackendHealth.unhealthy(
          backend, ((MappingSourceException) cause).getReason(), cause.getMessage());
    }
    if (cause instanceof ConfigurationException) {
      return BackendHealth.unhealthy(
          backend, ((ConfigurationException) cause).getReason(), cause.getMessage());
    }
    return BackendHealth.unhealthy(backend, BACKEND_UNAVAILABLE, String.valueOf(cause));
  }
}
