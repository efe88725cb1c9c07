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
import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_BACKEND_DATA;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.backend.MappingSource.MappingSourceException;
import com.google.iamauth.mapper.model.IdentityMapping;
import com.google.iamauth.mapper.model.MappingSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public final class CrdMappingSourceTest {

  @Rule public final MockitoRule mockito = MockitoJUnit.rule();

  @Mock private IdentityMappingProvider provider;
  @InjectMocks private CrdMappingSource source;

  @Test
  public void fetch_splitsByResourceType() throws Exception {
    when(provider.listIdentityMappings())
        .thenReturn(
            ImmutableList.of(
                mapping("arn:aws:iam::123456789012:role/Admin", "admin", "system:masters"),
                mapping("arn:aws:iam::123456789012:user/team/Alice", "alice"),
                mapping("arn:aws:iam::123456789012:role/Viewer", "viewer")));

    MappingSet mappingSet = source.fetch();

    assertThat(source.getBackendMode()).isEqualTo(BackendMode.CRD);
    assertThat(mappingSet.roleMappings()).hasSize(2);
    assertThat(mappingSet.roleMappings().get(0).roleArn())
        .isEqualTo("arn:aws:iam::123456789012:role/Admin");
    assertThat(mappingSet.roleMappings().get(0).groups()).containsExactly("system:masters");
    assertThat(mappingSet.roleMappings().get(1).username()).isEqualTo("viewer");
    assertThat(mappingSet.userMappings()).hasSize(1);
    assertThat(mappingSet.userMappings().get(0).userArn())
        .isEqualTo("arn:aws:iam::123456789012:user/team/Alice");
    assertThat(mappingSet.autoMappedAccounts()).isEmpty();
  }

  @Test
  public void fetch_invalidArn_malformed() throws Exception {
    when(provider.listIdentityMappings())
        .thenReturn(ImmutableList.of(mapping("arn:aws:iam::123456789012:group/Admins", "admins")));

    MappingSourceException e = assertThrows(MappingSourceException.class, source::fetch);

    assertThat(e.getReason()).isEqualTo(MALFORMED_BACKEND_DATA);
  }

  private static IdentityMapping mapping(String arn, String username, String... groups) {
    return IdentityMapping.builder()
        .setIdentityArn(arn)
        .setUsername(username)
        .setGroups(ImmutableList.copyOf(groups))
        .build();
  }
}
