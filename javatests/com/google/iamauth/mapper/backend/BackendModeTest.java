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

import static com.google.common.truth.Truth.assertThat;
import static com.google.iamauth.mapper.model.ErrorReason.EMPTY_BACKEND_MODE;
import static com.google.iamauth.mapper.model.ErrorReason.UNKNOWN_BACKEND;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.config.ConfigurationException;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public final class BackendModeTest {

  @Test
  public void fromConfigName_roundTripsEveryBackend(@TestParameter BackendMode backend)
      throws Exception {
    assertThat(BackendMode.fromConfigName(backend.getConfigName())).isEqualTo(backend);
  }

  @Test
  public void fromConfigName_isCaseSensitive() {
    ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> BackendMode.fromConfigName("file"));

    assertThat(e.getReason()).isEqualTo(UNKNOWN_BACKEND);
  }

  @Test
  public void parseOrder_keepsOrderAndDropsRepeats() throws Exception {
    assertThat(BackendMode.parseOrder(ImmutableList.of("CRD", " File ", "CRD", "EKSConfigMap")))
        .containsExactly(BackendMode.CRD, BackendMode.FILE, BackendMode.EKS_CONFIG_MAP)
        .inOrder();
  }

  @Test
  public void parseOrder_empty_throws() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class, () -> BackendMode.parseOrder(ImmutableList.of()));

    assertThat(e.getReason()).isEqualTo(EMPTY_BACKEND_MODE);
  }
}
