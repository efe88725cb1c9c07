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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static com.google.iamauth.mapper.model.ErrorReason.BACKEND_UNAVAILABLE;
import static com.google.iamauth.mapper.model.ErrorReason.NO_HEALTHY_BACKEND;
import static com.google.iamauth.mapper.testing.TestMappings.BASTION_ROLE_ARN;
import static com.google.iamauth.mapper.testing.TestMappings.role;
import static com.google.iamauth.mapper.testing.TestMappings.roles;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.iamauth.mapper.arn.ArnScrubber;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.index.MappingIndex;
import com.google.iamauth.mapper.index.ResolvedMapping;
import com.google.iamauth.mapper.testing.FakeMappingSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MappingIndexHolderTest {

  private static final Duration DEADLINE = Duration.ofSeconds(5);

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final FakeMappingSource source = new FakeMappingSource(BackendMode.FILE);
  private final MappingIndexHolder holder =
      new MappingIndexHolder(
          new BackendMergeCoordinator("aws", executor, new ArnScrubber(ImmutableSet.of())),
          ImmutableList.of(BackendMode.FILE),
          ImmutableMap.of(BackendMode.FILE, source));

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void current_beforeFirstReload_empty() {
    assertThat(holder.current()).isEmpty();
  }

  @Test
  public void reload_publishesIndex() throws Exception {
    source.setMappingSet(roles(role(BASTION_ROLE_ARN, "bastion")));

    BuildReport report = holder.reload(DEADLINE);

    assertThat(holder.current()).isPresent();
    assertThat(holder.current().get()).isSameInstanceAs(report.index().get());
    assertThat(holder.current().get().lookup(BASTION_ROLE_ARN)).isPresent();
  }

  @Test
  public void reload_firstBuildFails_throws() {
    source.setFailure(BACKEND_UNAVAILABLE);

    MappingBuildException e =
        assertThrows(MappingBuildException.class, () -> holder.reload(DEADLINE));

    assertThat(e.getReason()).isEqualTo(NO_HEALTHY_BACKEND);
    assertThat(e.getReport().backendHealth().get(0).errorReason()).hasValue(BACKEND_UNAVAILABLE);
    assertThat(holder.current()).isEmpty();
  }

  @Test
  public void reload_laterBuildFails_keepsServingPreviousIndex() throws Exception {
    source.setMappingSet(roles(role(BASTION_ROLE_ARN, "bastion")));
    holder.reload(DEADLINE);
    MappingIndex published = holder.current().get();
    source.setFailure(BACKEND_UNAVAILABLE);

    BuildReport report = holder.reload(DEADLINE);

    assertThat(report.index()).isEmpty();
    assertThat(holder.current().get()).isSameInstanceAs(published);
  }

  @Test
  public void reload_snapshotTakenBeforeSwapIsUnchanged() throws Exception {
    source.setMappingSet(roles(role(BASTION_ROLE_ARN, "old")));
    holder.reload(DEADLINE);
    MappingIndex snapshot = holder.current().get();
    source.setMappingSet(roles(role(BASTION_ROLE_ARN, "new")));

    holder.reload(DEADLINE);

    assertThat(snapshot.lookup(BASTION_ROLE_ARN).map(ResolvedMapping::username)).hasValue("old");
    assertThat(holder.current().get().lookup(BASTION_ROLE_ARN).map(ResolvedMapping::username))
        .hasValue("new");
  }

  @Test
  public void reload_concurrentReadersSeeOneConsistentIndex() throws Exception {
    String otherArn = "arn:aws:iam::123456789012:role/Other";
    source.setMappingSet(roles(role(BASTION_ROLE_ARN, "v1"), role(otherArn, "v1")));
    holder.reload(DEADLINE);
    AtomicBoolean done = new AtomicBoolean();
    List<Future<Integer>> readers = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      readers.add(
          executor.submit(
              () -> {
                int inconsistent = 0;
                while (!done.get()) {
                  MappingIndex index = holder.current().get();
                  Optional<String> first =
                      index.lookup(BASTION_ROLE_ARN).map(ResolvedMapping::username);
                  Optional<String> second = index.lookup(otherArn).map(ResolvedMapping::username);
                  if (first.isEmpty() || !first.equals(second)) {
                    inconsistent++;
                  }
                }
                return inconsistent;
              }));
    }

    for (int i = 0; i < 50; i++) {
      String version = "v" + (i % 2 == 0 ? 2 : 1);
      source.setMappingSet(roles(role(BASTION_ROLE_ARN, version), role(otherArn, version)));
      holder.reload(DEADLINE);
    }
    done.set(true);

    for (Future<Integer> reader : readers) {
      assertThat(reader.get()).isEqualTo(0);
    }
  }
}
