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

import com.google.common.util.concurrent.AbstractScheduledService;
import com.google.iamauth.mapper.config.Annotations.ReloadDeadline;
import com.google.iamauth.mapper.config.Annotations.ReloadInterval;
import java.time.Duration;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guava service that builds the first mapping index on start up and rebuilds it on a fixed delay.
 * Start up fails if the first build fails, since there is nothing to serve yet.
 */
public final class MappingReloadService extends AbstractScheduledService {

  private static final Logger logger = LoggerFactory.getLogger(MappingReloadService.class);

  private final MappingIndexHolder holder;
  private final Duration interval;
  private final Duration deadline;

  @Inject
  public MappingReloadService(
      MappingIndexHolder holder,
      @ReloadInterval Duration interval,
      @ReloadDeadline Duration deadline) {
    this.holder = holder;
    this.interval = interval;
    this.deadline = deadline;
  }

  @Override
  protected void startUp() throws MappingBuildException {
    holder.reload(deadline);
    logger.info("Mapping reload service started, reloading every {}", interval);
  }

  @Override
  protected void runOneIteration() {
    try {
      holder.reload(deadline);
    } catch (Exception e) {
      // Keep the schedule alive; the last published index keeps serving.
      logger.error("Exception occurred while reloading mappings", e);
    }
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(interval, interval);
  }
}
