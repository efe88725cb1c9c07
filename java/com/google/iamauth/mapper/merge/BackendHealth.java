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
import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.model.ErrorReason;
import java.util.Optional;

/** Whether one backend contributed to a build, and why not if it did not. */
@AutoValue
public abstract class BackendHealth {

  public static BackendHealth healthy(BackendMode backend) {
    return new AutoValue_BackendHealth(backend, Optional.empty(), Optional.empty());
  }

  public static BackendHealth unhealthy(BackendMode backend, ErrorReason reason, String message) {
    return new AutoValue_BackendHealth(backend, Optional.of(reason), Optional.of(message));
  }

  public abstract BackendMode backend();

  public abstract Optional<ErrorReason> errorReason();

  public abstract Optional<String> errorMessage();

  public boolean isHealthy() {
    return errorReason().isEmpty();
  }
}
