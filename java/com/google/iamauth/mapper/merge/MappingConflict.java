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
import com.google.iamauth.mapper.model.MappingKind;

/** The same ARN was mapped by two backends. The backend earlier in the order won. */
@AutoValue
public abstract class MappingConflict {

  public static MappingConflict of(
      String arn, MappingKind kind, BackendMode winner, BackendMode ignored) {
    return new AutoValue_MappingConflict(arn, kind, winner, ignored);
  }

  public abstract String arn();

  public abstract MappingKind kind();

  /** Backend whose mapping is in effect. */
  public abstract BackendMode winner();

  /** Backend whose mapping was dropped. */
  public abstract BackendMode ignored();
}
