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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.util.concurrent.ServiceManager;
import com.google.iamauth.mapper.config.ConfigLoader;
import com.google.iamauth.mapper.config.ConfigValidator;
import com.google.iamauth.mapper.config.ConfigurationException;
import com.google.iamauth.mapper.merge.MappingBuildException;
import com.google.iamauth.mapper.merge.MappingIndexHolder;
import com.google.iamauth.mapper.model.Config;
import com.google.iamauth.mapper.model.ResolutionResult;
import com.google.iamauth.mapper.resolver.IdentityResolver;
import com.google.iamauth.mapper.webhook.TokenReviewStatusEncoder;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application which keeps an index of IAM identity mappings loaded from the configured backends,
 * reloading it periodically. With {@code --resolve_arn} it instead resolves a single caller and
 * prints the resulting {@code TokenReview}.
 */
final class IdentityMapperApplication {

  private static final Logger logger = LoggerFactory.getLogger(IdentityMapperApplication.class);

  private IdentityMapperApplication() {}

  /** Parses input arguments, loads the configuration and starts the reload service. */
  public static void main(String[] args) {
    IdentityMapperArgs params = new IdentityMapperArgs();
    JCommander commander = JCommander.newBuilder().addObject(params).build();
    try {
      commander.parse(args);
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      commander.usage();
      System.exit(2);
    }
    if (params.isHelp()) {
      commander.usage();
      return;
    }

    Config config;
    try {
      config = loadConfig(params);
    } catch (ConfigurationException e) {
      logger.error("Invalid configuration", e);
      System.exit(1);
      return;
    }
    logger.info(
        "Starting identity mapper for cluster '{}' in partition {} with backends {}",
        config.clusterId(),
        config.partitionId(),
        config.backendMode());
    Injector injector = Guice.createInjector(new IdentityMapperModule(config));

    if (params.getResolveArn().isPresent()) {
      System.exit(resolveOnce(injector, config, params));
    }

    ServiceManager serviceManager = injector.getInstance(ServiceManager.class);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    serviceManager.stopAsync().awaitStopped(5, TimeUnit.SECONDS);
                  } catch (TimeoutException e) {
                    logger.warn("Services did not stop within 5 seconds", e);
                  }
                }));
    try {
      serviceManager.startAsync().awaitHealthy();
    } catch (IllegalStateException e) {
      logger.error("Identity mapper failed to start", e);
      System.exit(1);
    }
  }

  /** Loads the config file if one was given, applies flag overrides and validates the result. */
  static Config loadConfig(IdentityMapperArgs params) throws ConfigurationException {
    Config fromFile =
        params.getConfigPath().isPresent()
            ? new ConfigLoader().load(params.getConfigPath().get())
            : Config.builder().build();
    Config config = params.applyOverrides(fromFile);
    ConfigValidator.validate(config);
    return config;
  }

  private static int resolveOnce(Injector injector, Config config, IdentityMapperArgs params) {
    try {
      injector.getInstance(MappingIndexHolder.class).reload(config.reloadDeadline());
    } catch (MappingBuildException e) {
      logger.error("Could not load any mappings", e);
      return 1;
    }
    ResolutionResult result =
        injector
            .getInstance(IdentityResolver.class)
            .resolve(
                params.getResolveArn().get(),
                params.getResolveAccountId(),
                params.getResolveSessionName());
    try {
      System.out.println(
          injector.getInstance(TokenReviewStatusEncoder.class).encodeToJson(result));
    } catch (JsonProcessingException e) {
      logger.error("Could not encode the TokenReview", e);
      return 1;
    }
    return result.isAllowed() ? 0 : 3;
  }
}
