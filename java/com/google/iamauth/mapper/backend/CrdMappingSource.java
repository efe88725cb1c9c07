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

import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_BACKEND_DATA;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.arn.PrincipalArn;
import com.google.iamauth.mapper.model.IdentityMapping;
import com.google.iamauth.mapper.model.MappingSet;
import com.google.iamauth.mapper.model.RoleMapping;
import com.google.iamauth.mapper.model.UserMapping;
import java.util.Optional;

/**
 * Reads mappings from {@code IAMIdentityMapping} custom resources. The resource type of each ARN
 * decides whether it becomes a role or a user mapping. This backend never auto-maps accounts.
 */
public final class CrdMappingSource implements MappingSource {

  private final IdentityMappingProvider provider;

  public CrdMappingSource(IdentityMappingProvider provider) {
    this.provider = provider;
  }

  @Override
  public BackendMode getBackendMode() {
    return BackendMode.CRD;
  }

  @Override
  public MappingSet fetch() throws MappingSourceException {
    ImmutableList.Builder<RoleMapping> roleMappings = ImmutableList.builder();
    ImmutableList.Builder<UserMapping> userMappings = ImmutableList.builder();
    for (IdentityMapping mapping : provider.listIdentityMappings()) {
      Optional<PrincipalArn> arn = PrincipalArn.parse(mapping.identityArn());
      if (arn.isEmpty()) {
        throw new MappingSourceException(
            String.format(
                "IAMIdentityMapping ARN '%s' is not an IAM role or user ARN.",
                mapping.identityArn()),
            MALFORMED_BACKEND_DATA);
      }
      switch (arn.get().kind()) {
        case ROLE:
          roleMappings.add(mapping.toRoleMapping());
          break;
        case USER:
          userMappings.add(mapping.toUserMapping());
          break;
      }
    }
    return MappingSet.builder()
        .setRoleMappings(roleMappings.build())
        .setUserMappings(userMappings.build())
        .build();
  }
}
