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

package com.google.iamauth.mapper.config;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static com.google.iamauth.mapper.model.ErrorReason.MALFORMED_CONFIG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.iamauth.mapper.model.Config;
import com.google.iamauth.mapper.model.RoleMapping;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConfigLoaderTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final ConfigLoader loader = new ConfigLoader();

  @Test
  public void load_fullConfig() throws Exception {
    Path path =
        write(
            "partition: aws",
            "clusterID: test-cluster",
            "backendMode:",
            "  - MountedFile",
            "  - File",
            "mountedFilePath: /etc/mapper/mappings.yaml",
            "reloadIntervalSeconds: 30",
            "mapRoles:",
            "  - rolearn: arn:aws:iam::123456789012:role/Bastion",
            "    username: \"{{SessionName}}@bastion\"",
            "    groups:",
            "      - system:masters",
            "mapUsers:",
            "  - userarn: arn:aws:iam::123456789012:user/Alice",
            "    username: alice",
            "mapAccounts:",
            "  - \"111122223333\"",
            "scrubbedAccounts:",
            "  - \"444455556666\"",
            "someFutureSetting: true");

    Config config = loader.load(path);

    assertThat(config.partitionId()).isEqualTo("aws");
    assertThat(config.clusterId()).isEqualTo("test-cluster");
    assertThat(config.backendMode()).containsExactly("MountedFile", "File").inOrder();
    assertThat(config.mountedFilePath()).hasValue("/etc/mapper/mappings.yaml");
    assertThat(config.reloadInterval()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.reloadDeadline())
        .isEqualTo(Duration.ofSeconds(Config.DEFAULT_RELOAD_DEADLINE_SECONDS));
    assertThat(config.roleMappings())
        .containsExactly(
            RoleMapping.builder()
                .setRoleArn("arn:aws:iam::123456789012:role/Bastion")
                .setUsername("{{SessionName}}@bastion")
                .setGroups(ImmutableList.of("system:masters"))
                .build());
    assertThat(config.userMappings()).hasSize(1);
    assertThat(config.userMappings().get(0).groups()).isEmpty();
    assertThat(config.autoMappedAwsAccounts()).containsExactly("111122223333");
    assertThat(config.scrubbedAwsAccounts()).containsExactly("444455556666");
  }

  @Test
  public void load_emptyMapping_usesDefaults() throws Exception {
    Config config = loader.load(write("clusterID: minimal"));

    assertThat(config.partitionId()).isEqualTo(Config.DEFAULT_PARTITION);
    assertThat(config.backendMode()).containsExactly("File");
    assertThat(config.roleMappings()).isEmpty();
    assertThat(config.mountedFilePath()).isEmpty();
  }

  @Test
  public void load_mixedCaseMappingKeys() throws Exception {
    Config config =
        loader.load(
            write(
                "mapRoles:",
                "  - roleARN: arn:aws:iam::123456789012:role/Admin",
                "    Username: admin",
                "    Groups:",
                "      - system:masters"));

    assertThat(config.roleMappings().get(0).roleArn())
        .isEqualTo("arn:aws:iam::123456789012:role/Admin");
    assertThat(config.roleMappings().get(0).groups()).containsExactly("system:masters");
  }

  @Test
  public void load_doesNotValidate() throws Exception {
    Path path = write("backendMode:", "  - MountedFile", "partition: aws-moon");

    Config config = loader.load(path);

    assertThat(config.backendMode()).containsExactly("MountedFile");
    assertThat(config.partitionId()).isEqualTo("aws-moon");
    assertThat(config.mountedFilePath()).isEmpty();
  }

  @Test
  public void load_unparseable_throws() throws Exception {
    Path path = write("mapRoles: [unclosed");

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(path));

    assertThat(e.getReason()).isEqualTo(MALFORMED_CONFIG);
  }

  @Test
  public void load_missingFile_throws() {
    Path path = folder.getRoot().toPath().resolve("missing.yaml");

    ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(path));

    assertThat(e.getReason()).isEqualTo(MALFORMED_CONFIG);
    assertThat(e).hasCauseThat().isInstanceOf(IOException.class);
  }

  private Path write(String... lines) throws IOException {
    Path path = folder.newFile().toPath();
    Files.write(path, String.join("\n", lines).getBytes(UTF_8));
    return path;
  }
}
