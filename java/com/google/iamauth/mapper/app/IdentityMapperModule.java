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

package com.google.iamauth.mapper.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ServiceManager;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.backend.ConfigMapMappingSource;
import com.google.iamauth.mapper.backend.CrdMappingSource;
import com.google.iamauth.mapper.backend.LocalConfigMapDataProvider;
import com.google.iamauth.mapper.backend.LocalIdentityMappingProvider;
import com.google.iamauth.mapper.backend.MappingSource;
import com.google.iamauth.mapper.backend.MountedFileMappingSource;
import com.google.iamauth.mapper.backend.StaticMappingSource;
import com.google.iamauth.mapper.config.Annotations.BackendOrder;
import com.google.iamauth.mapper.config.Annotations.MappingFetchExecutor;
import com.google.iamauth.mapper.config.Annotations.PartitionId;
import com.google.iamauth.mapper.config.Annotations.ReloadDeadline;
import com.google.iamauth.mapper.config.Annotations.ReloadInterval;
import com.google.iamauth.mapper.config.Annotations.ScrubbedAccounts;
import com.google.iamauth.mapper.config.ConfigurationException;
import com.google.iamauth.mapper.config.YamlObjectMapper;
import com.google.iamauth.mapper.merge.MappingReloadService;
import com.google.iamauth.mapper.model.Config;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.inject.Singleton;

/** Module for the identity mapper, wiring a validated {@link Config} to the resolver. */
public final class IdentityMapperModule extends AbstractModule {

  private final Config config;

  public IdentityMapperModule(Config config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
    bind(ObjectMapper.class).toInstance(new YamlObjectMapper());
    bind(String.class).annotatedWith(PartitionId.class).toInstance(config.partitionId());
    bind(Duration.class).annotatedWith(ReloadInterval.class).toInstance(config.reloadInterval());
    bind(Duration.class).annotatedWith(ReloadDeadline.class).toInstance(config.reloadDeadline());
  }

  @Provides
  @ScrubbedAccounts
  ImmutableSet<String> provideScrubbedAccounts() {
    return ImmutableSet.copyOf(config.scrubbedAwsAccounts());
  }

  @Provides
  @Singleton
  @BackendOrder
  ImmutableList<BackendMode> provideBackendOrder() throws ConfigurationException {
    return BackendMode.parseOrder(config.backendMode());
  }

  /** One source per configured backend. Paths were checked when the config was validated. */
  @Provides
  @Singleton
  ImmutableMap<BackendMode, MappingSource> provideMappingSources(
      @BackendOrder ImmutableList<BackendMode> backendOrder, ObjectMapper mapper) {
    ImmutableMap.Builder<BackendMode, MappingSource> sources = ImmutableMap.builder();
    for (BackendMode backend : backendOrder) {
      sources.put(backend, createSource(backend, mapper));
    }
    return sources.build();
  }

  private MappingSource createSource(BackendMode backend, ObjectMapper mapper) {
    switch (backend) {
      case FILE:
        return new StaticMappingSource(config.embeddedMappings());
      case MOUNTED_FILE:
        return new MountedFileMappingSource(Path.of(config.mountedFilePath().get()), mapper);
      case EKS_CONFIG_MAP:
        return new ConfigMapMappingSource(
            new LocalConfigMapDataProvider(Path.of(config.configMapDataPath().get()), mapper),
            mapper);
      case CRD:
        return new CrdMappingSource(
            new LocalIdentityMappingProvider(Path.of(config.identityMappingsPath().get()), mapper));
    }
    throw new IllegalArgumentException("Unsupported backend " + backend);
  }

  @Provides
  @Singleton
  @MappingFetchExecutor
  ExecutorService provideMappingFetchExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("mapping-fetch-%d").setDaemon(true).build());
  }

  @Provides
  @Singleton
  ServiceManager provideServiceManager(MappingReloadService reloadService) {
    return new ServiceManager(ImmutableList.of(reloadService));
  }
}
