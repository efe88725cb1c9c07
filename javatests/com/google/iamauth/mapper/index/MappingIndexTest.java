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

package com.google.iamauth.mapper.index;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static com.google.iamauth.mapper.testing.TestMappings.role;
import static com.google.iamauth.mapper.testing.TestMappings.user;
import static org.junit.Assert.assertThrows;

import com.google.iamauth.mapper.backend.BackendMode;
import com.google.iamauth.mapper.model.MappingKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MappingIndexTest {

  private static final String ROLE_FOO = "arn:aws:iam::111111111111:role/Foo";
  private static final String TEAM_ROLE_FOO = "arn:aws:iam::111111111111:role/team/Foo";

  @Test
  public void lookup_exactArn() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addRoleMapping(role(ROLE_FOO, "foo", "viewers"), BackendMode.FILE)
            .build();

    ResolvedMapping rule = index.lookup(ROLE_FOO).get();

    assertThat(rule.arn()).isEqualTo(ROLE_FOO);
    assertThat(rule.kind()).isEqualTo(MappingKind.ROLE);
    assertThat(rule.username()).isEqualTo("foo");
    assertThat(rule.groups()).containsExactly("viewers");
    assertThat(rule.backend()).isEqualTo(BackendMode.FILE);
    assertThat(rule.autoMapped()).isFalse();
  }

  @Test
  public void lookup_ignoresPath() {
    MappingIndex index =
        MappingIndex.builder("aws").addRoleMapping(role(ROLE_FOO, "foo"), BackendMode.FILE).build();

    assertThat(index.lookup(TEAM_ROLE_FOO).map(ResolvedMapping::username)).hasValue("foo");
  }

  @Test
  public void lookup_exactPathWinsOverPathIgnoringMatch() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addRoleMapping(role(ROLE_FOO, "root-foo"), BackendMode.FILE)
            .addRoleMapping(role(TEAM_ROLE_FOO, "team-foo"), BackendMode.FILE)
            .build();

    assertThat(index.lookup(TEAM_ROLE_FOO).map(ResolvedMapping::username)).hasValue("team-foo");
    assertThat(index.lookup(ROLE_FOO).map(ResolvedMapping::username)).hasValue("root-foo");
  }

  @Test
  public void lookup_noExactPath_firstDeclaredWins() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addRoleMapping(role(TEAM_ROLE_FOO, "team-foo"), BackendMode.FILE)
            .addRoleMapping(role(ROLE_FOO, "root-foo"), BackendMode.FILE)
            .build();

    assertThat(
            index
                .lookup("arn:aws:iam::111111111111:role/other/Foo")
                .map(ResolvedMapping::username))
        .hasValue("team-foo");
  }

  @Test
  public void lookup_assumedRole_matchesRoleMapping() {
    MappingIndex index =
        MappingIndex.builder("aws").addRoleMapping(role(ROLE_FOO, "foo"), BackendMode.FILE).build();

    assertThat(index.lookup("arn:aws:sts::111111111111:assumed-role/Foo/session")).isPresent();
  }

  @Test
  public void lookup_roleAndUserKeptApart() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addUserMapping(
                user("arn:aws:iam::111111111111:user/Foo", "foo-user"), BackendMode.FILE)
            .build();

    assertThat(index.lookup(ROLE_FOO)).isEmpty();
    assertThat(
            index.lookup("arn:aws:iam::111111111111:user/Foo").map(ResolvedMapping::username))
        .hasValue("foo-user");
  }

  @Test
  public void lookup_autoMappedAccount() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addAutoMappedAccount("222222222222", BackendMode.EKS_CONFIG_MAP)
            .build();

    ResolvedMapping rule = index.lookup("arn:aws:iam::222222222222:user/team/Bob").get();

    assertThat(rule.autoMapped()).isTrue();
    assertThat(rule.username()).isEqualTo("arn:aws:iam::222222222222:user/team/Bob");
    assertThat(rule.groups()).isEmpty();
    assertThat(rule.backend()).isEqualTo(BackendMode.EKS_CONFIG_MAP);
  }

  @Test
  public void lookup_autoMappedAssumedRole_usesCanonicalRoleArn() {
    MappingIndex index =
        MappingIndex.builder("aws").addAutoMappedAccount("222222222222", BackendMode.FILE).build();

    ResolvedMapping rule =
        index.lookup("arn:aws:sts::222222222222:assumed-role/Dev/session").get();

    assertThat(rule.username()).isEqualTo("arn:aws:iam::222222222222:role/Dev");
  }

  @Test
  public void lookup_autoMappedAccountInOtherPartition_notFound() {
    MappingIndex index =
        MappingIndex.builder("aws").addAutoMappedAccount("222222222222", BackendMode.FILE).build();

    assertThat(index.lookup("arn:aws-cn:iam::222222222222:user/Bob")).isEmpty();
  }

  @Test
  public void lookup_mappingPartitionOverridesConfiguredPartition() {
    String chinaRole = "arn:aws-cn:iam::111111111111:role/Foo";
    MappingIndex index =
        MappingIndex.builder("aws")
            .addRoleMapping(role(chinaRole, "china-foo"), BackendMode.FILE)
            .build();

    assertThat(index.lookup(chinaRole).map(ResolvedMapping::username)).hasValue("china-foo");
    assertThat(index.lookup(ROLE_FOO)).isEmpty();
  }

  @Test
  public void lookup_explicitMappingWinsOverAutoMap() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .addAutoMappedAccount("111111111111", BackendMode.FILE)
            .addRoleMapping(role(ROLE_FOO, "foo"), BackendMode.FILE)
            .build();

    ResolvedMapping rule = index.lookup(ROLE_FOO).get();

    assertThat(rule.autoMapped()).isFalse();
    assertThat(rule.username()).isEqualTo("foo");
  }

  @Test
  public void lookup_unknownOrMalformed_notFound() {
    MappingIndex index =
        MappingIndex.builder("aws").addRoleMapping(role(ROLE_FOO, "foo"), BackendMode.FILE).build();

    assertThat(index.lookup("arn:aws:iam::111111111111:role/Bar")).isEmpty();
    assertThat(index.lookup("arn:aws:iam::111111111111")).isEmpty();
  }

  @Test
  public void addRoleMapping_userArn_throws() {
    MappingIndex.Builder builder = MappingIndex.builder("aws");

    assertThrows(
        IllegalArgumentException.class,
        () ->
            builder.addRoleMapping(
                role("arn:aws:iam::111111111111:user/Foo", "foo"), BackendMode.FILE));
  }

  @Test
  public void counts() {
    MappingIndex index =
        MappingIndex.builder("aws")
            .setGeneration(7)
            .addRoleMapping(role(ROLE_FOO, "foo"), BackendMode.FILE)
            .addRoleMapping(role(TEAM_ROLE_FOO, "team-foo"), BackendMode.FILE)
            .addUserMapping(user("arn:aws:iam::111111111111:user/Bob", "bob"), BackendMode.FILE)
            .addAutoMappedAccount("222222222222", BackendMode.FILE)
            .addAutoMappedAccount("222222222222", BackendMode.CRD)
            .build();

    assertThat(index.getGeneration()).isEqualTo(7);
    assertThat(index.getPartitionId()).isEqualTo("aws");
    assertThat(index.getRoleMappingCount()).isEqualTo(2);
    assertThat(index.getUserMappingCount()).isEqualTo(1);
    assertThat(index.getAutoMappedAccountCount()).isEqualTo(1);
  }
}
